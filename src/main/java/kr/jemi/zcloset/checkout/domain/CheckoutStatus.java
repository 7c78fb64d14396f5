package kr.jemi.zcloset.checkout.domain;

import java.time.Duration;
import java.util.Set;

/**
 * 특정 시각 기준 체크아웃 세션의 스냅샷.
 */
public record CheckoutStatus(String checkoutId,
                             String holderId,
                             CheckoutPhase phase,
                             Set<String> productIds,
                             Duration remaining,
                             Duration graceRemaining) {

    public CheckoutStatus {
        productIds = Set.copyOf(productIds);
    }

    public boolean isFinished() {
        return phase == CheckoutPhase.IDLE || phase == CheckoutPhase.REDIRECTED;
    }
}
