package kr.jemi.zcloset.reservation.infrastructure.in.web.dto;

import kr.jemi.zcloset.reservation.domain.ReserveOutcome;

import java.util.Set;

public record ReserveResponse(Set<String> reserved, Set<String> conflicted, Set<String> failed) {

    public static ReserveResponse from(ReserveOutcome outcome) {
        return new ReserveResponse(outcome.reserved(), outcome.conflicted(), outcome.failed());
    }
}
