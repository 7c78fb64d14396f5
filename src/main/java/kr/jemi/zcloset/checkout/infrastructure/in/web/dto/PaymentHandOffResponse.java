package kr.jemi.zcloset.checkout.infrastructure.in.web.dto;

import kr.jemi.zcloset.checkout.domain.PendingPayment;

import java.util.Set;

public record PaymentHandOffResponse(String reference, Set<String> productIds) {

    public static PaymentHandOffResponse from(PendingPayment pendingPayment) {
        return new PaymentHandOffResponse(pendingPayment.reference(), pendingPayment.productIds());
    }
}
