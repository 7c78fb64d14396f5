package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;

public interface HeartbeatCheckoutUseCase {

    CheckoutStatus heartbeat(String checkoutId, String holderId);
}
