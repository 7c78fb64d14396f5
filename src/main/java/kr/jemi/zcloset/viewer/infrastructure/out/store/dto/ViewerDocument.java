package kr.jemi.zcloset.viewer.infrastructure.out.store.dto;

import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.DocumentKeys;
import kr.jemi.zcloset.viewer.domain.Viewer;

public record ViewerDocument(String productId, String viewerId, long lastSeenMillis) {

    public static final String PRODUCT_ID = "productId";
    public static final String VIEWER_ID = "viewerId";
    public static final String LAST_SEEN = "lastSeen";

    public static String keyOf(String productId, String viewerId) {
        return DocumentKeys.compose(productId, viewerId);
    }

    public static ViewerDocument from(Viewer viewer) {
        return new ViewerDocument(viewer.productId(), viewer.viewerId(), viewer.lastSeen().toEpochMilli());
    }

    public Document toDocument() {
        return Document.builder(keyOf(productId, viewerId))
                .field(PRODUCT_ID, productId)
                .field(VIEWER_ID, viewerId)
                .field(LAST_SEEN, Long.toString(lastSeenMillis))
                .build();
    }
}
