package kr.jemi.zcloset.checkout.domain;

import java.util.Set;

/**
 * 결제가 승인되어 상품이 판매 완료되었음을 알린다. 카탈로그가 상품을 판매 완료로 표시할 때 사용한다.
 */
public record CheckoutCompletedEvent(String reference, String holderId, Set<String> productIds) {

    public CheckoutCompletedEvent {
        productIds = Set.copyOf(productIds);
    }
}
