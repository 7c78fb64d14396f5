package kr.jemi.zcloset.common.store.redis;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.DocumentQuery;
import kr.jemi.zcloset.common.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Redis 해시로 문서를, Redis 셋으로 필드 인덱스를 저장한다.
 * <p>
 * 조건부 쓰기는 WATCH/MULTI/EXEC 낙관적 트랜잭션으로 처리하고, 변경 알림은 Redis pub/sub 채널로 발행한다.
 * 필드 쿼리는 indexedFields에 포함된 필드만 지원한다.
 */
public class RedisDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDocumentStore.class);

    private static final String KEY_PREFIX = "zcloset:";
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final Set<String> indexedFields;

    public RedisDocumentStore(StringRedisTemplate redisTemplate,
                              RedisMessageListenerContainer listenerContainer,
                              Set<String> indexedFields) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.indexedFields = Set.copyOf(indexedFields);
    }

    @Override
    public void put(String collection, Document document) {
        mutate(collection, document.key(), current -> true, document);
    }

    @Override
    public boolean putIf(String collection, Document document, Predicate<Optional<Document>> precondition) {
        return mutate(collection, document.key(), precondition, document);
    }

    @Override
    public void delete(String collection, String key) {
        mutate(collection, key, current -> true, null);
    }

    @Override
    public boolean deleteIf(String collection, String key, Predicate<Optional<Document>> precondition) {
        return mutate(collection, key, precondition, null);
    }

    @Override
    public Optional<Document> get(String collection, String key) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(documentKey(collection, key));
        return toDocument(key, entries);
    }

    @Override
    public List<Document> query(DocumentQuery query) {
        if (query.isByKey()) {
            return get(query.collection(), query.value()).stream().toList();
        }
        if (!indexedFields.contains(query.field())) {
            throw new IllegalArgumentException("인덱스되지 않은 필드로 조회할 수 없습니다: " + query.field());
        }
        Set<String> keys = redisTemplate.opsForSet()
                .members(indexKey(query.collection(), query.field(), query.value()));
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        return keys.stream()
                .map(key -> get(query.collection(), key))
                .flatMap(Optional::stream)
                .filter(query::matches)
                .sorted(Comparator.comparing(Document::key))
                .toList();
    }

    @Override
    public Subscription subscribe(DocumentQuery query, Consumer<List<Document>> onChange) {
        if (!query.isByKey() && !indexedFields.contains(query.field())) {
            throw new IllegalArgumentException("인덱스되지 않은 필드는 구독할 수 없습니다: " + query.field());
        }
        ChannelTopic topic = new ChannelTopic(channel(query.topic()));
        MessageListener listener = (message, pattern) -> deliver(query, onChange);
        listenerContainer.addMessageListener(listener, topic);
        deliver(query, onChange);
        return () -> listenerContainer.removeMessageListener(listener, topic);
    }

    private void deliver(DocumentQuery query, Consumer<List<Document>> onChange) {
        try {
            onChange.accept(query(query));
        } catch (RuntimeException e) {
            log.warn("구독 알림 처리 실패: {}", query.topic(), e);
        }
    }

    private boolean mutate(String collection, String key,
                           Predicate<Optional<Document>> precondition, Document next) {
        if (next != null && next.fields().isEmpty()) {
            throw new IllegalArgumentException("필드가 없는 문서는 저장할 수 없습니다: " + key);
        }
        String redisKey = documentKey(collection, key);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Mutation mutation = redisTemplate.execute(new SessionCallback<Mutation>() {
                @Override
                public Mutation execute(RedisOperations operations) throws DataAccessException {
                    operations.watch(redisKey);
                    Optional<Document> current = toDocument(key, operations.opsForHash().entries(redisKey));
                    if ((next == null && current.isEmpty()) || !precondition.test(current)) {
                        operations.unwatch();
                        return Mutation.REJECTED;
                    }
                    operations.multi();
                    operations.delete(redisKey);
                    current.ifPresent(doc -> indexKeys(collection, doc)
                            .forEach(indexKey -> operations.opsForSet().remove(indexKey, key)));
                    if (next != null) {
                        operations.opsForHash().putAll(redisKey, next.fields());
                        indexKeys(collection, next)
                                .forEach(indexKey -> operations.opsForSet().add(indexKey, key));
                    }
                    List<Object> results = operations.exec();
                    if (results == null || results.isEmpty()) {
                        return Mutation.CONFLICTED;
                    }
                    publish(collection, key, current, next);
                    return Mutation.APPLIED;
                }
            });
            if (mutation == Mutation.APPLIED) {
                return true;
            }
            if (mutation == Mutation.REJECTED) {
                return false;
            }
            log.debug("동시 변경 감지, 재시도: {} (attempt={})", redisKey, attempt);
        }
        throw new OptimisticLockingFailureException("동시 변경이 계속되어 쓰기에 실패했습니다: " + redisKey);
    }

    private void publish(String collection, String key, Optional<Document> before, Document after) {
        Set<String> topics = new LinkedHashSet<>();
        topics.add(DocumentQuery.topic(collection, DocumentQuery.KEY, key));
        before.ifPresent(doc -> topics.addAll(fieldTopics(collection, doc)));
        if (after != null) {
            topics.addAll(fieldTopics(collection, after));
        }
        topics.forEach(topic -> redisTemplate.convertAndSend(channel(topic), key));
    }

    private List<String> fieldTopics(String collection, Document document) {
        return indexedFields.stream()
                .filter(field -> document.fields().containsKey(field))
                .map(field -> DocumentQuery.topic(collection, field, document.fields().get(field)))
                .toList();
    }

    private List<String> indexKeys(String collection, Document document) {
        return indexedFields.stream()
                .filter(field -> document.fields().containsKey(field))
                .map(field -> indexKey(collection, field, document.fields().get(field)))
                .toList();
    }

    private static Optional<Document> toDocument(String key, Map<Object, Object> entries) {
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> fields = new LinkedHashMap<>();
        entries.forEach((field, value) -> fields.put(Objects.toString(field), Objects.toString(value)));
        return Optional.of(new Document(key, fields));
    }

    private static String documentKey(String collection, String key) {
        return KEY_PREFIX + collection + ":doc:" + key;
    }

    private static String indexKey(String collection, String field, String value) {
        return KEY_PREFIX + collection + ":idx:" + field + ":" + value;
    }

    private static String channel(String topic) {
        return KEY_PREFIX + "topic:" + topic;
    }

    private enum Mutation {
        APPLIED, REJECTED, CONFLICTED
    }
}
