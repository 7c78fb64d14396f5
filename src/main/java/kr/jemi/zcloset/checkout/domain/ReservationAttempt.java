package kr.jemi.zcloset.checkout.domain;

import java.util.Set;

public record ReservationAttempt(Set<String> reserved, Set<String> conflicted, Set<String> failed) {

    public ReservationAttempt {
        reserved = Set.copyOf(reserved);
        conflicted = Set.copyOf(conflicted);
        failed = Set.copyOf(failed);
    }
}
