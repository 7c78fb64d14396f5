package kr.jemi.zcloset.reservation.infrastructure.out.store;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.DocumentQuery;
import kr.jemi.zcloset.common.store.DocumentStore;
import kr.jemi.zcloset.reservation.application.port.out.ReservationPort;
import kr.jemi.zcloset.reservation.domain.Reservation;
import kr.jemi.zcloset.reservation.infrastructure.out.store.dto.ReservationDocument;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

@Component
public class ReservationStoreAdapter implements ReservationPort {

    public static final String COLLECTION = "productReservations";

    private final DocumentStore documentStore;

    public ReservationStoreAdapter(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Optional<Reservation> find(String productId) {
        return documentStore.get(COLLECTION, productId).map(ReservationStoreAdapter::toDomain);
    }

    @Override
    public boolean createIfClaimable(Reservation reservation, Instant now) {
        Document document = ReservationDocument.from(reservation).toDocument();
        return documentStore.putIf(COLLECTION, document, current -> current
                .map(ReservationStoreAdapter::toDomain)
                .map(existing -> existing.isClaimableBy(reservation.holderId(), now))
                .orElse(true));
    }

    @Override
    public boolean renewIfHeldBy(Reservation renewed) {
        Document document = ReservationDocument.from(renewed).toDocument();
        return documentStore.putIf(COLLECTION, document, current -> current
                .map(existing -> existing.hasFieldValue(ReservationDocument.HOLDER_ID, renewed.holderId()))
                .orElse(false));
    }

    @Override
    public boolean deleteIfHeldBy(String productId, String holderId) {
        return documentStore.deleteIf(COLLECTION, productId, current -> current
                .map(existing -> existing.hasFieldValue(ReservationDocument.HOLDER_ID, holderId))
                .orElse(false));
    }

    @Override
    public Subscription watch(String productId, Consumer<Optional<Reservation>> onChange) {
        return documentStore.subscribe(DocumentQuery.byKey(COLLECTION, productId),
                documents -> onChange.accept(documents.stream().findFirst().map(ReservationStoreAdapter::toDomain)));
    }

    private static Reservation toDomain(Document document) {
        return ReservationDocument.from(document).toDomain();
    }
}
