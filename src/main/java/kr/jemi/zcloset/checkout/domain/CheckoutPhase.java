package kr.jemi.zcloset.checkout.domain;

public enum CheckoutPhase {
    IDLE,
    RESERVING,
    ACTIVE,
    WARNING,
    REDIRECTED
}
