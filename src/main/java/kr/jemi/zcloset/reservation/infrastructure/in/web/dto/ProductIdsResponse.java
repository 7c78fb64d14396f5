package kr.jemi.zcloset.reservation.infrastructure.in.web.dto;

import java.util.Set;

public record ProductIdsResponse(Set<String> productIds) {
}
