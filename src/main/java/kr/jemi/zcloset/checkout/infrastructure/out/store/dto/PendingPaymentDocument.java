package kr.jemi.zcloset.checkout.infrastructure.out.store.dto;

import kr.jemi.zcloset.checkout.domain.PendingPayment;
import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.DocumentKeys;

import java.time.Instant;
import java.util.Set;

/**
 * pendingPayments 컬렉션 문서 변환용 adapter DTO. 상품 ID 목록은 각 ID를 인코딩해 쉼표로 이어 저장한다.
 */
public record PendingPaymentDocument(String reference, String holderId, Set<String> productIds, Instant createdAt) {

    public static final String HOLDER_ID = "holderId";
    public static final String PRODUCT_IDS = "productIds";
    public static final String CREATED_AT = "createdAt";

    public static PendingPaymentDocument from(Document document) {
        Set<String> productIds = DocumentKeys.splitList(document.require(PRODUCT_IDS));
        return new PendingPaymentDocument(document.key(), document.require(HOLDER_ID), productIds,
                document.requireInstant(CREATED_AT));
    }

    public static PendingPaymentDocument from(PendingPayment pendingPayment) {
        return new PendingPaymentDocument(pendingPayment.reference(), pendingPayment.holderId(),
                pendingPayment.productIds(), pendingPayment.createdAt());
    }

    public Document toDocument() {
        return Document.builder(reference)
                .field(HOLDER_ID, holderId)
                .field(PRODUCT_IDS, DocumentKeys.joinList(productIds))
                .field(CREATED_AT, createdAt)
                .build();
    }

    public PendingPayment toDomain() {
        return new PendingPayment(reference, holderId, productIds, createdAt);
    }
}
