package kr.jemi.zcloset.common.store;

import kr.jemi.zcloset.common.scope.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private static final String COLLECTION = "items";

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private Document doc(String key, String owner) {
        return Document.builder(key).field("owner", owner).build();
    }

    @Nested
    @DisplayName("조건부 쓰기")
    class ConditionalWrite {

        @Test
        @DisplayName("문서가 없을 때만 쓰는 조건은 두 번째 쓰기를 거부한다")
        void putIfAbsent() {
            boolean first = store.putIf(COLLECTION, doc("A", "u1"), current -> current.isEmpty());
            boolean second = store.putIf(COLLECTION, doc("A", "u2"), current -> current.isEmpty());

            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(store.get(COLLECTION, "A")).get()
                    .extracting(d -> d.require("owner")).isEqualTo("u1");
        }

        @Test
        @DisplayName("조건을 만족하지 않으면 지우지 않는다")
        void deleteIfRejected() {
            store.put(COLLECTION, doc("A", "u1"));

            boolean deleted = store.deleteIf(COLLECTION, "A", current -> current.map(d -> d.hasFieldValue("owner", "u2")).orElse(false));

            assertThat(deleted).isFalse();
            assertThat(store.get(COLLECTION, "A")).isPresent();
        }

        @Test
        @DisplayName("없는 문서를 지우면 false를 반환한다")
        void deleteAbsent() {
            assertThat(store.deleteIf(COLLECTION, "missing", current -> true)).isFalse();
        }
    }

    @Nested
    @DisplayName("구독")
    class Subscribe {

        @Test
        @DisplayName("구독 즉시 현재 결과를 한 번 전달한다")
        void deliversImmediately() {
            store.put(COLLECTION, doc("A", "u1"));
            List<List<Document>> received = new ArrayList<>();

            store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), received::add);

            assertThat(received).hasSize(1);
            assertThat(received.get(0)).extracting(Document::key).containsExactly("A");
        }

        @Test
        @DisplayName("필드 구독은 값이 바뀌어 결과에서 빠질 때도 알림을 받는다")
        void fieldSubscriptionSeesLeavingDocument() {
            List<List<Document>> received = new ArrayList<>();
            store.subscribe(DocumentQuery.byField(COLLECTION, "owner", "u1"), received::add);

            store.put(COLLECTION, doc("A", "u1"));
            store.put(COLLECTION, doc("A", "u2"));

            assertThat(received).hasSize(3);
            assertThat(received.get(1)).extracting(Document::key).containsExactly("A");
            assertThat(received.get(2)).isEmpty();
        }

        @Test
        @DisplayName("해제한 구독은 더 이상 알림을 받지 않는다")
        void cancelledSubscriptionIsSilent() {
            List<List<Document>> received = new ArrayList<>();
            Subscription subscription = store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), received::add);

            subscription.cancel();
            store.put(COLLECTION, doc("A", "u1"));

            assertThat(received).hasSize(1);
        }

        @Test
        @DisplayName("토픽의 마지막 구독이 해제되면 토픽도 정리된다")
        void lastCancelRemovesTopic() {
            Subscription first = store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), docs -> { });
            Subscription second = store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), docs -> { });

            first.cancel();
            assertThat(store.subscribedTopicCount()).isEqualTo(1);

            second.cancel();
            second.cancel();
            assertThat(store.subscribedTopicCount()).isZero();
        }

        @Test
        @DisplayName("구독자 예외는 쓰기를 실패시키지 않는다")
        void listenerFailureIsIsolated() {
            List<List<Document>> received = new ArrayList<>();
            store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), docs -> {
                if (!docs.isEmpty()) {
                    throw new IllegalStateException("boom");
                }
            });
            store.subscribe(DocumentQuery.byKey(COLLECTION, "A"), received::add);

            assertThatCode(() -> store.put(COLLECTION, doc("A", "u1"))).doesNotThrowAnyException();
            assertThat(received).hasSize(2);
        }
    }

    @Test
    @DisplayName("필드 조회 결과는 키 순서로 정렬된다")
    void queryIsSortedByKey() {
        store.put(COLLECTION, doc("B", "u1"));
        store.put(COLLECTION, doc("A", "u1"));
        store.put(COLLECTION, doc("C", "u2"));

        assertThat(store.queryByField(COLLECTION, "owner", "u1"))
                .extracting(Document::key)
                .containsExactly("A", "B");
    }
}
