package kr.jemi.zcloset.checkout.infrastructure.out.store;

import kr.jemi.zcloset.checkout.application.port.out.PendingPaymentPort;
import kr.jemi.zcloset.checkout.domain.PendingPayment;
import kr.jemi.zcloset.checkout.infrastructure.out.store.dto.PendingPaymentDocument;
import kr.jemi.zcloset.common.store.DocumentStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PendingPaymentStoreAdapter implements PendingPaymentPort {

    public static final String COLLECTION = "pendingPayments";

    private final DocumentStore documentStore;

    public PendingPaymentStoreAdapter(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public void save(PendingPayment pendingPayment) {
        documentStore.put(COLLECTION, PendingPaymentDocument.from(pendingPayment).toDocument());
    }

    @Override
    public Optional<PendingPayment> find(String reference) {
        return documentStore.get(COLLECTION, reference)
                .map(document -> PendingPaymentDocument.from(document).toDomain());
    }

    @Override
    public void delete(String reference) {
        documentStore.delete(COLLECTION, reference);
    }
}
