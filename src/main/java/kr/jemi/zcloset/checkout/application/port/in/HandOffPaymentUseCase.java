package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.PendingPayment;

public interface HandOffPaymentUseCase {

    PendingPayment handOff(String checkoutId, String holderId);
}
