package kr.jemi.zcloset.viewer.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zcloset.common.web.EventStream;
import kr.jemi.zcloset.viewer.application.port.in.CountViewersUseCase;
import kr.jemi.zcloset.viewer.application.port.in.IssueViewerTokenUseCase;
import kr.jemi.zcloset.viewer.application.port.in.TrackViewerUseCase;
import kr.jemi.zcloset.viewer.infrastructure.in.web.dto.ViewerCountResponse;
import kr.jemi.zcloset.viewer.infrastructure.in.web.dto.ViewerTokenResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Viewer", description = "상품 실시간 조회자 수")
@RestController
public class ViewerApiController {

    private final TrackViewerUseCase trackViewerUseCase;
    private final CountViewersUseCase countViewersUseCase;
    private final IssueViewerTokenUseCase issueViewerTokenUseCase;
    private final long streamTimeoutMillis;

    public ViewerApiController(TrackViewerUseCase trackViewerUseCase,
                               CountViewersUseCase countViewersUseCase,
                               IssueViewerTokenUseCase issueViewerTokenUseCase,
                               @Value("${zcloset.viewer.stream-timeout-ms}") long streamTimeoutMillis) {
        this.trackViewerUseCase = trackViewerUseCase;
        this.countViewersUseCase = countViewersUseCase;
        this.issueViewerTokenUseCase = issueViewerTokenUseCase;
        this.streamTimeoutMillis = streamTimeoutMillis;
    }

    @Operation(summary = "익명 조회자 토큰 발급", description = "로그인하지 않은 방문자가 X-Holder-Id 및 viewerId로 사용할 토큰을 발급합니다.")
    @PostMapping("/api/viewers/token")
    public ResponseEntity<ViewerTokenResponse> issueToken() {
        return ResponseEntity.ok(new ViewerTokenResponse(issueViewerTokenUseCase.issueViewerToken()));
    }

    @Operation(summary = "조회자 등록", description = "상품 상세 페이지 진입 시 호출합니다.")
    @PutMapping("/api/products/{productId}/viewers/{viewerId}")
    public ResponseEntity<Void> addViewer(@PathVariable String productId, @PathVariable String viewerId) {
        trackViewerUseCase.addViewer(productId, viewerId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "조회자 삭제", description = "상품 상세 페이지 이탈 시 호출합니다.")
    @DeleteMapping("/api/products/{productId}/viewers/{viewerId}")
    public ResponseEntity<Void> removeViewer(@PathVariable String productId, @PathVariable String viewerId) {
        trackViewerUseCase.removeViewer(productId, viewerId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "조회자 수 조회")
    @GetMapping("/api/products/{productId}/viewers/count")
    public ResponseEntity<ViewerCountResponse> count(@PathVariable String productId) {
        return ResponseEntity.ok(new ViewerCountResponse(productId, countViewersUseCase.countViewers(productId)));
    }

    @Operation(summary = "조회자 수 구독 (SSE)", description = "조회자 수가 바뀔 때마다 count 이벤트를 보냅니다.")
    @GetMapping(value = "/api/products/{productId}/viewers/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String productId) {
        EventStream stream = EventStream.open(streamTimeoutMillis);
        stream.bind(countViewersUseCase.subscribeCount(productId,
                count -> stream.send("count", new ViewerCountResponse(productId, count))));
        return stream.emitter();
    }
}
