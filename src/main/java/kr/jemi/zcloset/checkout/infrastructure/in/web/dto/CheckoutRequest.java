package kr.jemi.zcloset.checkout.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CheckoutRequest(@NotEmpty List<@NotBlank String> productIds) {
}
