package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;
import kr.jemi.zcloset.common.scope.Subscription;

import java.util.function.Consumer;

public interface WatchCheckoutUseCase {

    /**
     * 카운트다운과 상태 변화를 구독한다. 구독이 살아 있는 동안 구매자가 화면에 머무는 것으로 본다.
     */
    Subscription watch(String checkoutId, String holderId, Consumer<CheckoutStatus> listener);
}
