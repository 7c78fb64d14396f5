package kr.jemi.zcloset.common.store;

import kr.jemi.zcloset.common.scope.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 프로세스 내부 메모리에 문서를 보관하는 저장소. 변경 알림은 쓰기를 수행한 스레드에서 동기적으로 전달된다.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, Map<String, Document>> collections = new HashMap<>();
    private final Map<String, List<Listener>> listeners = new ConcurrentHashMap<>();

    @Override
    public void put(String collection, Document document) {
        Optional<Document> before;
        synchronized (this) {
            before = Optional.ofNullable(documents(collection).put(document.key(), document));
        }
        publish(collection, document.key(), before, Optional.of(document));
    }

    @Override
    public boolean putIf(String collection, Document document, Predicate<Optional<Document>> precondition) {
        Optional<Document> before;
        synchronized (this) {
            before = Optional.ofNullable(documents(collection).get(document.key()));
            if (!precondition.test(before)) {
                return false;
            }
            documents(collection).put(document.key(), document);
        }
        publish(collection, document.key(), before, Optional.of(document));
        return true;
    }

    @Override
    public void delete(String collection, String key) {
        deleteIf(collection, key, current -> true);
    }

    @Override
    public boolean deleteIf(String collection, String key, Predicate<Optional<Document>> precondition) {
        Optional<Document> before;
        synchronized (this) {
            before = Optional.ofNullable(documents(collection).get(key));
            if (before.isEmpty() || !precondition.test(before)) {
                return false;
            }
            documents(collection).remove(key);
        }
        publish(collection, key, before, Optional.empty());
        return true;
    }

    @Override
    public synchronized Optional<Document> get(String collection, String key) {
        return Optional.ofNullable(documents(collection).get(key));
    }

    @Override
    public synchronized List<Document> query(DocumentQuery query) {
        return documents(query.collection()).values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(Document::key))
                .toList();
    }

    @Override
    public Subscription subscribe(DocumentQuery query, Consumer<List<Document>> onChange) {
        Listener listener = new Listener(query, onChange);
        String topic = query.topic();
        listeners.compute(topic, (t, topicListeners) -> {
            List<Listener> updated = topicListeners == null ? new CopyOnWriteArrayList<>() : topicListeners;
            updated.add(listener);
            return updated;
        });
        listener.fire();
        return () -> {
            listener.active = false;
            // 마지막 구독이 해제되면 토픽도 지운다
            listeners.computeIfPresent(topic, (t, topicListeners) -> {
                topicListeners.remove(listener);
                return topicListeners.isEmpty() ? null : topicListeners;
            });
        };
    }

    int subscribedTopicCount() {
        return listeners.size();
    }

    public synchronized void clear() {
        collections.clear();
    }

    private Map<String, Document> documents(String collection) {
        return collections.computeIfAbsent(collection, c -> new HashMap<>());
    }

    private void publish(String collection, String key, Optional<Document> before, Optional<Document> after) {
        Set<String> topics = new LinkedHashSet<>();
        topics.add(DocumentQuery.topic(collection, DocumentQuery.KEY, key));
        before.ifPresent(doc -> addFieldTopics(topics, collection, doc));
        after.ifPresent(doc -> addFieldTopics(topics, collection, doc));
        for (String topic : topics) {
            for (Listener listener : listeners.getOrDefault(topic, List.of())) {
                listener.fire();
            }
        }
    }

    private void addFieldTopics(Set<String> topics, String collection, Document document) {
        document.fields().forEach((field, value) -> topics.add(DocumentQuery.topic(collection, field, value)));
    }

    private final class Listener {

        private final DocumentQuery query;
        private final Consumer<List<Document>> onChange;
        private volatile boolean active = true;

        private Listener(DocumentQuery query, Consumer<List<Document>> onChange) {
            this.query = query;
            this.onChange = onChange;
        }

        private void fire() {
            if (!active) {
                return;
            }
            try {
                onChange.accept(query(query));
            } catch (RuntimeException e) {
                log.warn("구독 알림 처리 실패: {}", query.topic(), e);
            }
        }
    }
}
