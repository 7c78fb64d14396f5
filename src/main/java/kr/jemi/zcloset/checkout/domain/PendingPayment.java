package kr.jemi.zcloset.checkout.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.common.validation.SelfValidating;

import java.time.Instant;
import java.util.Set;

/**
 * 결제사로 넘긴 주문. 결제사에서 돌아왔을 때 어떤 상품을 해제하거나 판매 처리할지 알기 위해 저장한다.
 */
public record PendingPayment(@NotBlank String reference,
                             @NotBlank String holderId,
                             @NotEmpty Set<String> productIds,
                             @NotNull Instant createdAt) implements SelfValidating {

    public PendingPayment(String reference, String holderId, Set<String> productIds, Instant createdAt) {
        this.reference = reference;
        this.holderId = holderId;
        this.productIds = productIds == null ? null : Set.copyOf(productIds);
        this.createdAt = createdAt;
        validateSelf();
    }
}
