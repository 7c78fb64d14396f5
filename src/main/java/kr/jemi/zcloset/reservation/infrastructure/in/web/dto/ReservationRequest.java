package kr.jemi.zcloset.reservation.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ReservationRequest(@NotEmpty List<@NotBlank String> productIds) {
}
