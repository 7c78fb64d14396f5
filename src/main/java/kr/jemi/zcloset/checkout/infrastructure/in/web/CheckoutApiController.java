package kr.jemi.zcloset.checkout.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcloset.checkout.application.port.in.ContinueCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.EnterCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.GetCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HandOffPaymentUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HeartbeatCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.LeaveCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.WatchCheckoutUseCase;
import kr.jemi.zcloset.checkout.infrastructure.in.web.dto.CheckoutRequest;
import kr.jemi.zcloset.checkout.infrastructure.in.web.dto.CheckoutResponse;
import kr.jemi.zcloset.checkout.infrastructure.in.web.dto.PaymentHandOffResponse;
import kr.jemi.zcloset.common.web.EventStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Checkout", description = "체크아웃 카운트다운과 결제 이동")
@RestController
public class CheckoutApiController {

    private final EnterCheckoutUseCase enterCheckoutUseCase;
    private final GetCheckoutUseCase getCheckoutUseCase;
    private final HeartbeatCheckoutUseCase heartbeatCheckoutUseCase;
    private final ContinueCheckoutUseCase continueCheckoutUseCase;
    private final LeaveCheckoutUseCase leaveCheckoutUseCase;
    private final HandOffPaymentUseCase handOffPaymentUseCase;
    private final WatchCheckoutUseCase watchCheckoutUseCase;
    private final long streamTimeoutMillis;

    public CheckoutApiController(EnterCheckoutUseCase enterCheckoutUseCase,
                                 GetCheckoutUseCase getCheckoutUseCase,
                                 HeartbeatCheckoutUseCase heartbeatCheckoutUseCase,
                                 ContinueCheckoutUseCase continueCheckoutUseCase,
                                 LeaveCheckoutUseCase leaveCheckoutUseCase,
                                 HandOffPaymentUseCase handOffPaymentUseCase,
                                 WatchCheckoutUseCase watchCheckoutUseCase,
                                 @Value("${zcloset.checkout.stream-timeout-ms}") long streamTimeoutMillis) {
        this.enterCheckoutUseCase = enterCheckoutUseCase;
        this.getCheckoutUseCase = getCheckoutUseCase;
        this.heartbeatCheckoutUseCase = heartbeatCheckoutUseCase;
        this.continueCheckoutUseCase = continueCheckoutUseCase;
        this.leaveCheckoutUseCase = leaveCheckoutUseCase;
        this.handOffPaymentUseCase = handOffPaymentUseCase;
        this.watchCheckoutUseCase = watchCheckoutUseCase;
        this.streamTimeoutMillis = streamTimeoutMillis;
    }

    @Operation(summary = "체크아웃 진입", description = "다른 구매자가 결제 중이지 않은 상품을 선점하고 10분 카운트다운을 시작합니다.")
    @PostMapping("/api/checkout")
    public ResponseEntity<CheckoutResponse> enter(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @Valid @RequestBody CheckoutRequest request) {
        return ResponseEntity.ok(CheckoutResponse.from(
                enterCheckoutUseCase.enter(holderId, request.productIds())));
    }

    @Operation(summary = "체크아웃 상태 조회", description = "남은 시간, 유예 시간, 현재 단계를 반환합니다.")
    @GetMapping("/api/checkout/{checkoutId}")
    public ResponseEntity<CheckoutResponse> get(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String checkoutId) {
        return ResponseEntity.ok(CheckoutResponse.from(getCheckoutUseCase.getCheckout(checkoutId, holderId)));
    }

    @Operation(summary = "heartbeat", description = "진행 중인 체크아웃의 선점을 연장합니다. WARNING 상태에서는 연장하지 않습니다.")
    @PostMapping("/api/checkout/{checkoutId}/heartbeat")
    public ResponseEntity<CheckoutResponse> heartbeat(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String checkoutId) {
        return ResponseEntity.ok(CheckoutResponse.from(heartbeatCheckoutUseCase.heartbeat(checkoutId, holderId)));
    }

    @Operation(summary = "계속 진행", description = "만료 경고에 '계속'으로 응답합니다. 연장할 수 있는 상품이 없으면 410을 반환합니다.")
    @PostMapping("/api/checkout/{checkoutId}/continue")
    public ResponseEntity<CheckoutResponse> continueCheckout(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String checkoutId) {
        return ResponseEntity.ok(CheckoutResponse.from(
                continueCheckoutUseCase.continueCheckout(checkoutId, holderId)));
    }

    @Operation(summary = "체크아웃 이탈", description = "선점을 해제하고 장바구니 신호를 복구합니다. sendBeacon처럼 헤더를 보낼 수 없으면 holderId 파라미터를 사용합니다.")
    @PostMapping("/api/checkout/{checkoutId}/leave")
    public ResponseEntity<Void> leave(
            @Parameter(description = "구매자 ID") @RequestHeader(value = "X-Holder-Id", required = false) String holderHeader,
            @Parameter(description = "구매자 ID (헤더가 없을 때)") @RequestParam(value = "holderId", required = false) String holderParam,
            @PathVariable String checkoutId) {
        leaveCheckoutUseCase.leave(checkoutId, holderHeader != null ? holderHeader : holderParam);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "체크아웃 구독 (SSE)", description = "카운트다운과 단계 변화를 checkout 이벤트로 보냅니다. 연결되어 있는 동안 자동으로 선점이 연장됩니다.")
    @GetMapping(value = "/api/checkout/{checkoutId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String checkoutId) {
        EventStream stream = EventStream.open(streamTimeoutMillis);
        stream.bind(watchCheckoutUseCase.watch(checkoutId, holderId, status -> {
            stream.send("checkout", CheckoutResponse.from(status));
            if (status.isFinished()) {
                stream.close();
            }
        }));
        return stream.emitter();
    }

    @Operation(summary = "결제사로 이동", description = "결제할 상품 목록을 저장하고 세션을 REDIRECTED로 전환합니다. 이후 이탈해도 선점은 유지됩니다.")
    @PostMapping("/api/checkout/{checkoutId}/payment")
    public ResponseEntity<PaymentHandOffResponse> handOff(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @PathVariable String checkoutId) {
        return ResponseEntity.ok(PaymentHandOffResponse.from(handOffPaymentUseCase.handOff(checkoutId, holderId)));
    }
}
