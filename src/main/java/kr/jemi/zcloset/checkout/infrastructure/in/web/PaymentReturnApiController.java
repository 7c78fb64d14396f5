package kr.jemi.zcloset.checkout.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcloset.checkout.application.port.in.CompletePaymentUseCase;
import kr.jemi.zcloset.checkout.infrastructure.in.web.dto.PaymentReturnRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Payment", description = "결제사 복귀 처리")
@RestController
public class PaymentReturnApiController {

    private final CompletePaymentUseCase completePaymentUseCase;

    public PaymentReturnApiController(CompletePaymentUseCase completePaymentUseCase) {
        this.completePaymentUseCase = completePaymentUseCase;
    }

    @Operation(summary = "결제 결과 반영", description = "결제를 시작한 구매자만 호출할 수 있습니다. APPROVED면 상품을 판매 처리하고, REJECTED면 선점을 해제하고 장바구니로 되돌립니다.")
    @PostMapping("/api/payments/{reference}/return")
    public ResponseEntity<Void> paymentReturn(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String reference,
            @Valid @RequestBody PaymentReturnRequest request) {
        completePaymentUseCase.complete(reference, holderId, request.outcome());
        return ResponseEntity.noContent().build();
    }
}
