package kr.jemi.zcloset.reservation.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.common.validation.SelfValidating;

import java.time.Duration;
import java.time.Instant;

/**
 * 상품 하나에 대한 결제 선점. 만료 시각이 지나면 다른 구매자가 다시 선점할 수 있다.
 */
public record Reservation(@NotBlank String productId,
                          @NotBlank String holderId,
                          @NotNull Instant expiresAt,
                          @NotNull Instant updatedAt) implements SelfValidating {

    public Reservation(String productId, String holderId, Instant expiresAt, Instant updatedAt) {
        this.productId = productId;
        this.holderId = holderId;
        this.expiresAt = expiresAt;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static Reservation issue(String productId, String holderId, Instant now, Duration ttl) {
        return new Reservation(productId, holderId, now.plus(ttl), now);
    }

    public Reservation renew(Instant now, Duration ttl) {
        return new Reservation(productId, holderId, now.plus(ttl), now);
    }

    public boolean isLiveAt(Instant now) {
        return expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String holderId) {
        return this.holderId.equals(holderId);
    }

    /**
     * 관찰자 입장에서 이 상품이 다른 구매자에게 잠겨 있는지 판단한다.
     */
    public boolean blocks(String observerId, Instant now) {
        return isLiveAt(now) && !isHeldBy(observerId);
    }

    /**
     * 만료되었거나 본인이 보유한 선점이면 새로 선점할 수 있다.
     */
    public boolean isClaimableBy(String holderId, Instant now) {
        return !isLiveAt(now) || isHeldBy(holderId);
    }
}
