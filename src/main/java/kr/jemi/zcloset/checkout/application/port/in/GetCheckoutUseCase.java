package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;

public interface GetCheckoutUseCase {

    CheckoutStatus getCheckout(String checkoutId, String holderId);
}
