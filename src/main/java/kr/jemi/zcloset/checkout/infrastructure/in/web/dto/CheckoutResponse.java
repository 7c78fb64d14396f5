package kr.jemi.zcloset.checkout.infrastructure.in.web.dto;

import kr.jemi.zcloset.checkout.domain.CheckoutStatus;

import java.util.Set;

public record CheckoutResponse(String checkoutId,
                               String phase,
                               Set<String> productIds,
                               long remainingSeconds,
                               long graceRemainingSeconds) {

    public static CheckoutResponse from(CheckoutStatus status) {
        return new CheckoutResponse(
                status.checkoutId(),
                status.phase().name(),
                status.productIds(),
                status.remaining().toSeconds(),
                status.graceRemaining().toSeconds()
        );
    }
}
