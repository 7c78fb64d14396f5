package kr.jemi.zcloset.checkout.application.port.out;

import kr.jemi.zcloset.checkout.domain.CheckoutSession;

import java.util.Optional;

public interface CheckoutSessionPort {

    /**
     * 같은 구매자의 다른 세션이 요청한 상품 중 하나라도 붙잡고 있으면 저장하지 않고 false를 반환한다.
     */
    boolean register(CheckoutSession session);

    void save(CheckoutSession session);

    Optional<CheckoutSession> findById(String checkoutId);

    void delete(String checkoutId);
}
