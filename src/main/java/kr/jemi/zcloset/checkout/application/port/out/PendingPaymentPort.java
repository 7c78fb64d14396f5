package kr.jemi.zcloset.checkout.application.port.out;

import kr.jemi.zcloset.checkout.domain.PendingPayment;

import java.util.Optional;

public interface PendingPaymentPort {

    void save(PendingPayment pendingPayment);

    Optional<PendingPayment> find(String reference);

    void delete(String reference);
}
