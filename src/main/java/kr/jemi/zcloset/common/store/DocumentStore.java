package kr.jemi.zcloset.common.store;

import kr.jemi.zcloset.common.scope.Subscription;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 실시간 변경 알림을 제공하는 문서 저장소.
 * <p>
 * 문서 단위로 마지막 쓰기가 이긴다. 문서 간 트랜잭션은 없고, 한 문서에 대한 조건부 쓰기만 원자적으로 보장한다.
 * 모든 변경은 해당 문서의 키 토픽과 필드 토픽으로 발행되며, 구독자는 쿼리 결과 전체를 다시 받는다.
 */
public interface DocumentStore {

    void put(String collection, Document document);

    /**
     * 현재 문서가 precondition을 만족할 때만 쓴다. 읽기와 쓰기 사이에 다른 변경이 끼어들면 다시 평가한다.
     *
     * @return 실제로 썼으면 true
     */
    boolean putIf(String collection, Document document, Predicate<Optional<Document>> precondition);

    void delete(String collection, String key);

    /**
     * 현재 문서가 precondition을 만족할 때만 지운다.
     *
     * @return 실제로 지웠으면 true
     */
    boolean deleteIf(String collection, String key, Predicate<Optional<Document>> precondition);

    Optional<Document> get(String collection, String key);

    List<Document> query(DocumentQuery query);

    default List<Document> queryByField(String collection, String field, String value) {
        return query(DocumentQuery.byField(collection, field, value));
    }

    /**
     * 구독 즉시 현재 결과를 한 번 전달하고, 이후 쿼리에 영향을 주는 변경마다 다시 전달한다.
     */
    Subscription subscribe(DocumentQuery query, Consumer<List<Document>> onChange);
}
