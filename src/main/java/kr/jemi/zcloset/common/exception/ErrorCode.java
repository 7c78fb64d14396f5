package kr.jemi.zcloset.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    INVALID_REQUEST(400, "요청 값이 올바르지 않습니다"),
    HOLDER_REQUIRED(400, "사용자 식별자가 필요합니다"),
    NOTHING_TO_CHECKOUT(409, "결제 가능한 상품이 없습니다"),
    PRODUCT_ALREADY_RESERVED(409, "다른 사용자가 방금 결제를 시작한 상품입니다"),
    CHECKOUT_IN_PROGRESS(409, "이미 결제를 진행 중인 상품입니다"),
    CHECKOUT_NOT_FOUND(404, "체크아웃 세션을 찾을 수 없습니다"),
    CHECKOUT_NOT_OWNED(403, "본인의 체크아웃 세션이 아닙니다"),
    INVALID_CHECKOUT_STATE(409, "현재 체크아웃 상태에서 처리할 수 없는 요청입니다"),
    CHECKOUT_EXPIRED(410, "예약 시간이 만료되었습니다"),
    CHECKOUT_UNAVAILABLE(503, "잠시 후 다시 시도해 주세요"),
    PENDING_PAYMENT_NOT_FOUND(404, "결제 대기 정보를 찾을 수 없습니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
