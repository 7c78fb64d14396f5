package kr.jemi.zcloset.availability.infrastructure.in.web.dto;

import kr.jemi.zcloset.availability.domain.Availability;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public record AvailabilityResponse(Set<String> lockedByOthers,
                                   Set<String> wantedByOthers,
                                   Map<String, String> statuses) {

    public static AvailabilityResponse from(Collection<String> productIds, Availability availability) {
        Map<String, String> statuses = new LinkedHashMap<>();
        productIds.forEach(productId -> statuses.put(productId, availability.statusOf(productId).name()));
        return new AvailabilityResponse(availability.lockedByOthers(), availability.wantedByOthers(), statuses);
    }
}
