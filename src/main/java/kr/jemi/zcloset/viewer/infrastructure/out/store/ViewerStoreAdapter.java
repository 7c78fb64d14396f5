package kr.jemi.zcloset.viewer.infrastructure.out.store;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.DocumentQuery;
import kr.jemi.zcloset.common.store.DocumentStore;
import kr.jemi.zcloset.viewer.application.port.out.ViewerPort;
import kr.jemi.zcloset.viewer.domain.Viewer;
import kr.jemi.zcloset.viewer.infrastructure.out.store.dto.ViewerDocument;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;

@Component
public class ViewerStoreAdapter implements ViewerPort {

    public static final String COLLECTION = "productViewers";

    private final DocumentStore documentStore;

    public ViewerStoreAdapter(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public void save(Viewer viewer) {
        documentStore.put(COLLECTION, ViewerDocument.from(viewer).toDocument());
    }

    @Override
    public void delete(String productId, String viewerId) {
        documentStore.delete(COLLECTION, ViewerDocument.keyOf(productId, viewerId));
    }

    @Override
    public int countByProduct(String productId) {
        return documentStore.queryByField(COLLECTION, ViewerDocument.PRODUCT_ID, productId).size();
    }

    @Override
    public Subscription watchCount(String productId, IntConsumer onChange) {
        return documentStore.subscribe(DocumentQuery.byField(COLLECTION, ViewerDocument.PRODUCT_ID, productId),
                documents -> onChange.accept(documents.size()));
    }
}
