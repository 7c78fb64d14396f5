package kr.jemi.zcloset.reservation.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcloset.reservation.application.port.in.ExtendReservationsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.ReleaseReservationsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.ReserveProductsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.WatchReservationsUseCase;
import kr.jemi.zcloset.reservation.infrastructure.in.web.dto.ProductIdsResponse;
import kr.jemi.zcloset.reservation.infrastructure.in.web.dto.ReservationRequest;
import kr.jemi.zcloset.reservation.infrastructure.in.web.dto.ReserveResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Reservation", description = "상품 결제 선점")
@RestController
public class ReservationApiController {

    private final ReserveProductsUseCase reserveProductsUseCase;
    private final ExtendReservationsUseCase extendReservationsUseCase;
    private final ReleaseReservationsUseCase releaseReservationsUseCase;
    private final WatchReservationsUseCase watchReservationsUseCase;

    public ReservationApiController(ReserveProductsUseCase reserveProductsUseCase,
                                    ExtendReservationsUseCase extendReservationsUseCase,
                                    ReleaseReservationsUseCase releaseReservationsUseCase,
                                    WatchReservationsUseCase watchReservationsUseCase) {
        this.reserveProductsUseCase = reserveProductsUseCase;
        this.extendReservationsUseCase = extendReservationsUseCase;
        this.releaseReservationsUseCase = releaseReservationsUseCase;
        this.watchReservationsUseCase = watchReservationsUseCase;
    }

    @Operation(summary = "상품 선점", description = "상품마다 독립적으로 10분간 결제 선점을 시도합니다. 다른 구매자가 선점한 상품은 conflicted로 반환됩니다.")
    @PostMapping("/api/reservations")
    public ResponseEntity<ReserveResponse> reserve(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @Valid @RequestBody ReservationRequest request) {
        return ResponseEntity.ok(ReserveResponse.from(
                reserveProductsUseCase.reserve(request.productIds(), holderId)));
    }

    @Operation(summary = "선점 연장", description = "본인이 보유한 선점만 만료 시각을 갱신하고, 실제로 연장된 상품 ID를 반환합니다.")
    @PostMapping("/api/reservations/extend")
    public ResponseEntity<ProductIdsResponse> extend(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @Valid @RequestBody ReservationRequest request) {
        return ResponseEntity.ok(new ProductIdsResponse(
                extendReservationsUseCase.extend(request.productIds(), holderId)));
    }

    @Operation(summary = "선점 해제", description = "본인이 보유한 선점만 삭제합니다. 여러 번 호출해도 안전합니다.")
    @PostMapping("/api/reservations/release")
    public ResponseEntity<Void> release(
            @Parameter(description = "구매자 ID") @RequestHeader("X-Holder-Id") String holderId,
            @Valid @RequestBody ReservationRequest request) {
        releaseReservationsUseCase.release(request.productIds(), holderId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "잠긴 상품 조회", description = "다른 구매자가 결제 중인 상품 ID를 반환합니다.")
    @GetMapping("/api/reservations/locked")
    public ResponseEntity<ProductIdsResponse> findLocked(
            @Parameter(description = "구매자 ID") @RequestHeader(value = "X-Holder-Id", required = false) String holderId,
            @RequestParam List<String> productIds) {
        return ResponseEntity.ok(new ProductIdsResponse(
                watchReservationsUseCase.findReservedByOthers(productIds, holderId)));
    }
}
