package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;

public interface ContinueCheckoutUseCase {

    CheckoutStatus continueCheckout(String checkoutId, String holderId);
}
