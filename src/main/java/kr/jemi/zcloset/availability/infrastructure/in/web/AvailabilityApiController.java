package kr.jemi.zcloset.availability.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zcloset.availability.application.port.in.TrackAvailabilityUseCase;
import kr.jemi.zcloset.availability.application.port.in.TrackAvailabilityUseCase.AvailabilityTracking;
import kr.jemi.zcloset.availability.infrastructure.in.web.dto.AvailabilityResponse;
import kr.jemi.zcloset.common.web.EventStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@Tag(name = "Availability", description = "상품 가용성 (FREE / WANTED / LOCKED)")
@RestController
public class AvailabilityApiController {

    private final TrackAvailabilityUseCase trackAvailabilityUseCase;
    private final long streamTimeoutMillis;

    public AvailabilityApiController(TrackAvailabilityUseCase trackAvailabilityUseCase,
                                     @Value("${zcloset.availability.stream-timeout-ms}") long streamTimeoutMillis) {
        this.trackAvailabilityUseCase = trackAvailabilityUseCase;
        this.streamTimeoutMillis = streamTimeoutMillis;
    }

    @Operation(summary = "가용성 조회", description = "다른 구매자가 결제 중이면 LOCKED, 장바구니에 담았으면 WANTED로 표시합니다.")
    @GetMapping("/api/availability")
    public ResponseEntity<AvailabilityResponse> snapshot(
            @Parameter(description = "구매자 ID") @RequestHeader(value = "X-Holder-Id", required = false) String holderId,
            @RequestParam List<String> productIds) {
        return ResponseEntity.ok(AvailabilityResponse.from(productIds,
                trackAvailabilityUseCase.snapshot(productIds, holderId)));
    }

    @Operation(summary = "가용성 구독 (SSE)", description = "가용성이 바뀔 때마다 availability 이벤트를 보냅니다.")
    @GetMapping(value = "/api/availability/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @Parameter(description = "구매자 ID") @RequestHeader(value = "X-Holder-Id", required = false) String holderId,
            @RequestParam List<String> productIds) {
        EventStream stream = EventStream.open(streamTimeoutMillis);
        AvailabilityTracking tracking = trackAvailabilityUseCase.track(productIds, holderId,
                availability -> stream.send("availability", AvailabilityResponse.from(productIds, availability)));
        stream.bind(tracking::unsubscribe);
        return stream.emitter();
    }
}
