package kr.jemi.zcloset.reservation.infrastructure.out.store.dto;

import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.reservation.domain.Reservation;

import java.time.Instant;

/**
 * productReservations 컬렉션 문서와 도메인 선점을 변환하는 adapter DTO. 문서 키는 상품 ID다.
 */
public record ReservationDocument(String productId, String holderId, Instant expiresAt, Instant updatedAt) {

    public static final String PRODUCT_ID = "productId";
    public static final String HOLDER_ID = "holderId";
    public static final String EXPIRES_AT = "expiresAt";
    public static final String UPDATED_AT = "updatedAt";

    public static ReservationDocument from(Document document) {
        return new ReservationDocument(
                document.field(PRODUCT_ID).orElse(document.key()),
                document.require(HOLDER_ID),
                document.requireInstant(EXPIRES_AT),
                document.requireInstant(UPDATED_AT));
    }

    public static ReservationDocument from(Reservation reservation) {
        return new ReservationDocument(reservation.productId(), reservation.holderId(),
                reservation.expiresAt(), reservation.updatedAt());
    }

    public Document toDocument() {
        return Document.builder(productId)
                .field(PRODUCT_ID, productId)
                .field(HOLDER_ID, holderId)
                .field(EXPIRES_AT, expiresAt)
                .field(UPDATED_AT, updatedAt)
                .build();
    }

    public Reservation toDomain() {
        return new Reservation(productId, holderId, expiresAt, updatedAt);
    }
}
