package kr.jemi.zcloset.reservation.domain;

import java.util.Set;

public record ReserveOutcome(Set<String> reserved, Set<String> conflicted, Set<String> failed) {

    public ReserveOutcome {
        reserved = Set.copyOf(reserved);
        conflicted = Set.copyOf(conflicted);
        failed = Set.copyOf(failed);
    }

    public static ReserveOutcome empty() {
        return new ReserveOutcome(Set.of(), Set.of(), Set.of());
    }
}
