package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;

import java.util.Collection;

public interface EnterCheckoutUseCase {

    /**
     * 다른 구매자가 잠그지 않은 상품만 선점하고 카운트다운을 시작한다.
     */
    CheckoutStatus enter(String holderId, Collection<String> productIds);
}
