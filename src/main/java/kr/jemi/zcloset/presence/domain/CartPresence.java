package kr.jemi.zcloset.presence.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.common.validation.SelfValidating;

import java.time.Instant;

/**
 * 구매자의 장바구니에 상품이 담겨 있다는 신호. 결제를 막지 않고 다른 구매자에게 경고만 준다.
 */
public record CartPresence(@NotBlank String productId,
                           @NotBlank String holderId,
                           @NotNull Instant updatedAt) implements SelfValidating {

    public CartPresence(String productId, String holderId, Instant updatedAt) {
        this.productId = productId;
        this.holderId = holderId;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public boolean isHeldBy(String holderId) {
        return this.holderId.equals(holderId);
    }
}
