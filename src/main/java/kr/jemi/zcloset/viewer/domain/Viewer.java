package kr.jemi.zcloset.viewer.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.common.validation.SelfValidating;

import java.time.Instant;

public record Viewer(@NotBlank String productId,
                     @NotBlank String viewerId,
                     @NotNull Instant lastSeen) implements SelfValidating {

    public Viewer(String productId, String viewerId, Instant lastSeen) {
        this.productId = productId;
        this.viewerId = viewerId;
        this.lastSeen = lastSeen;
        validateSelf();
    }
}
