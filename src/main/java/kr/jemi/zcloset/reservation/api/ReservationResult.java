package kr.jemi.zcloset.reservation.api;

import java.util.Set;

/**
 * 선점 요청 결과. conflicted는 다른 구매자가 이미 선점한 상품, failed는 저장소 오류로 처리하지 못한 상품이다.
 */
public record ReservationResult(Set<String> reserved, Set<String> conflicted, Set<String> failed) {

    public ReservationResult {
        reserved = Set.copyOf(reserved);
        conflicted = Set.copyOf(conflicted);
        failed = Set.copyOf(failed);
    }

    public boolean hasReserved() {
        return !reserved.isEmpty();
    }
}
