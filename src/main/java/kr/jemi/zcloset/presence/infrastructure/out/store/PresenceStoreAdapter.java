package kr.jemi.zcloset.presence.infrastructure.out.store;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.DocumentQuery;
import kr.jemi.zcloset.common.store.DocumentStore;
import kr.jemi.zcloset.presence.application.port.out.PresencePort;
import kr.jemi.zcloset.presence.domain.CartPresence;
import kr.jemi.zcloset.presence.infrastructure.out.store.dto.CartPresenceDocument;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PresenceStoreAdapter implements PresencePort {

    public static final String COLLECTION = "productCartPresence";

    private final DocumentStore documentStore;

    public PresenceStoreAdapter(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public void save(CartPresence presence) {
        documentStore.put(COLLECTION, CartPresenceDocument.from(presence).toDocument());
    }

    @Override
    public void delete(String productId, String holderId) {
        documentStore.delete(COLLECTION, CartPresenceDocument.keyOf(productId, holderId));
    }

    @Override
    public List<CartPresence> findByProduct(String productId) {
        return documentStore.queryByField(COLLECTION, CartPresenceDocument.PRODUCT_ID, productId).stream()
                .map(document -> CartPresenceDocument.from(document).toDomain())
                .toList();
    }

    @Override
    public Subscription watchProduct(String productId, Runnable onChange) {
        return documentStore.subscribe(
                DocumentQuery.byField(COLLECTION, CartPresenceDocument.PRODUCT_ID, productId),
                documents -> onChange.run());
    }
}
