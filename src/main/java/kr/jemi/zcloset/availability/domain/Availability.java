package kr.jemi.zcloset.availability.domain;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 관찰자 한 명 기준의 상품 가용성. 잠긴 상품은 원하는 상품 집합에 포함될 수 없다.
 */
public record Availability(Set<String> lockedByOthers, Set<String> wantedByOthers) {

    public Availability {
        lockedByOthers = Set.copyOf(lockedByOthers);
        wantedByOthers = Set.copyOf(wantedByOthers);
        for (String productId : wantedByOthers) {
            if (lockedByOthers.contains(productId)) {
                throw new IllegalArgumentException("잠긴 상품은 WANTED로 표시할 수 없습니다: " + productId);
            }
        }
    }

    public static Availability empty() {
        return new Availability(Set.of(), Set.of());
    }

    /**
     * 잠긴 상품을 원하는 상품 집합에서 제외해 만든다.
     */
    public static Availability of(Set<String> lockedByOthers, Set<String> wantedByOthers) {
        Set<String> wanted = new LinkedHashSet<>(wantedByOthers);
        wanted.removeAll(lockedByOthers);
        return new Availability(lockedByOthers, wanted);
    }

    public AvailabilityStatus statusOf(String productId) {
        if (lockedByOthers.contains(productId)) {
            return AvailabilityStatus.LOCKED;
        }
        if (wantedByOthers.contains(productId)) {
            return AvailabilityStatus.WANTED;
        }
        return AvailabilityStatus.FREE;
    }
}
