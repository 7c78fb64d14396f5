package kr.jemi.zcloset.checkout.domain;

public enum PaymentOutcome {
    APPROVED,
    REJECTED
}
