package kr.jemi.zcloset.checkout.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.checkout.domain.PaymentOutcome;

public record PaymentReturnRequest(@NotNull PaymentOutcome outcome) {
}
