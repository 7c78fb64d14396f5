package kr.jemi.zcloset.presence.infrastructure.out.store.dto;

import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.DocumentKeys;
import kr.jemi.zcloset.presence.domain.CartPresence;

import java.time.Instant;

/**
 * productCartPresence 컬렉션 문서 변환용 adapter DTO. 문서 키는 상품 ID와 구매자 ID를 인코딩해 이어 만든다.
 */
public record CartPresenceDocument(String productId, String holderId, Instant updatedAt) {

    public static final String PRODUCT_ID = "productId";
    public static final String HOLDER_ID = "holderId";
    public static final String UPDATED_AT = "updatedAt";

    public static String keyOf(String productId, String holderId) {
        return DocumentKeys.compose(productId, holderId);
    }

    public static CartPresenceDocument from(Document document) {
        return new CartPresenceDocument(
                document.require(PRODUCT_ID),
                document.require(HOLDER_ID),
                document.requireInstant(UPDATED_AT));
    }

    public static CartPresenceDocument from(CartPresence presence) {
        return new CartPresenceDocument(presence.productId(), presence.holderId(), presence.updatedAt());
    }

    public Document toDocument() {
        return Document.builder(keyOf(productId, holderId))
                .field(PRODUCT_ID, productId)
                .field(HOLDER_ID, holderId)
                .field(UPDATED_AT, updatedAt)
                .build();
    }

    public CartPresence toDomain() {
        return new CartPresence(productId, holderId, updatedAt);
    }
}
