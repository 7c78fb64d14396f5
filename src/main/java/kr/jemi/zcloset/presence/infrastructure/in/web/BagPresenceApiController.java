package kr.jemi.zcloset.presence.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zcloset.presence.application.port.in.UpdateBagPresenceUseCase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Bag", description = "장바구니 담김 신호")
@RestController
public class BagPresenceApiController {

    private final UpdateBagPresenceUseCase updateBagPresenceUseCase;

    public BagPresenceApiController(UpdateBagPresenceUseCase updateBagPresenceUseCase) {
        this.updateBagPresenceUseCase = updateBagPresenceUseCase;
    }

    @Operation(summary = "장바구니 담기", description = "다른 구매자에게 이 상품을 원하는 사람이 있음을 알립니다.")
    @PutMapping("/api/bag/{productId}")
    public ResponseEntity<Void> add(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String productId) {
        updateBagPresenceUseCase.setPresent(productId, holderId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "장바구니에서 빼기")
    @DeleteMapping("/api/bag/{productId}")
    public ResponseEntity<Void> remove(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String productId) {
        updateBagPresenceUseCase.clearPresent(productId, holderId);
        return ResponseEntity.noContent().build();
    }
}
