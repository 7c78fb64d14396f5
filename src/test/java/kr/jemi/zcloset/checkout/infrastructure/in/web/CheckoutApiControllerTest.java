package kr.jemi.zcloset.checkout.infrastructure.in.web;

import kr.jemi.zcloset.checkout.application.port.in.CompletePaymentUseCase;
import kr.jemi.zcloset.checkout.application.port.in.ContinueCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.EnterCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.GetCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HandOffPaymentUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HeartbeatCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.LeaveCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.WatchCheckoutUseCase;
import kr.jemi.zcloset.checkout.domain.CheckoutPhase;
import kr.jemi.zcloset.checkout.domain.CheckoutStatus;
import kr.jemi.zcloset.checkout.domain.PaymentOutcome;
import kr.jemi.zcloset.common.exception.BusinessException;
import kr.jemi.zcloset.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({CheckoutApiController.class, PaymentReturnApiController.class})
class CheckoutApiControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    EnterCheckoutUseCase enterCheckoutUseCase;

    @MockitoBean
    GetCheckoutUseCase getCheckoutUseCase;

    @MockitoBean
    HeartbeatCheckoutUseCase heartbeatCheckoutUseCase;

    @MockitoBean
    ContinueCheckoutUseCase continueCheckoutUseCase;

    @MockitoBean
    LeaveCheckoutUseCase leaveCheckoutUseCase;

    @MockitoBean
    HandOffPaymentUseCase handOffPaymentUseCase;

    @MockitoBean
    WatchCheckoutUseCase watchCheckoutUseCase;

    @MockitoBean
    CompletePaymentUseCase completePaymentUseCase;

    @Test
    @DisplayName("체크아웃 진입 결과를 초 단위 남은 시간으로 반환한다")
    void enter_returns_countdown() throws Exception {
        given(enterCheckoutUseCase.enter("u1", List.of("P1")))
                .willReturn(new CheckoutStatus("c1", "u1", CheckoutPhase.ACTIVE, Set.of("P1"),
                        Duration.ofMinutes(10), Duration.ZERO));

        mockMvc.perform(post("/api/checkout")
                        .header("X-Holder-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productIds\":[\"P1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkoutId").value("c1"))
                .andExpect(jsonPath("$.phase").value("ACTIVE"))
                .andExpect(jsonPath("$.remainingSeconds").value(600));
    }

    @Test
    @DisplayName("구매자 헤더가 없으면 HOLDER_REQUIRED")
    void missing_holder_header() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productIds\":[\"P1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("HOLDER_REQUIRED"));
    }

    @Test
    @DisplayName("빈 상품 목록은 INVALID_REQUEST")
    void empty_product_ids() throws Exception {
        mockMvc.perform(post("/api/checkout")
                        .header("X-Holder-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("비즈니스 예외는 오류 코드의 HTTP 상태로 변환된다")
    void business_exception_mapping() throws Exception {
        given(continueCheckoutUseCase.continueCheckout("c1", "u1"))
                .willThrow(new BusinessException(ErrorCode.CHECKOUT_EXPIRED));

        mockMvc.perform(post("/api/checkout/c1/continue").header("X-Holder-Id", "u1"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("CHECKOUT_EXPIRED"));
    }

    @Test
    @DisplayName("sendBeacon 이탈은 holderId 파라미터로 처리된다")
    void leave_with_query_param() throws Exception {
        mockMvc.perform(post("/api/checkout/c1/leave").param("holderId", "u1"))
                .andExpect(status().isNoContent());

        then(leaveCheckoutUseCase).should().leave("c1", "u1");
    }

    @Test
    @DisplayName("다른 구매자의 체크아웃 조회는 403")
    void not_owned() throws Exception {
        willThrow(new BusinessException(ErrorCode.CHECKOUT_NOT_OWNED))
                .given(getCheckoutUseCase).getCheckout("c1", "u2");

        mockMvc.perform(get("/api/checkout/c1").header("X-Holder-Id", "u2"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CHECKOUT_NOT_OWNED"));
    }

    @Test
    @DisplayName("결제 복귀 결과를 반영한다")
    void payment_return() throws Exception {
        mockMvc.perform(post("/api/payments/c1/return")
                        .header("X-Holder-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"APPROVED\"}"))
                .andExpect(status().isNoContent());

        then(completePaymentUseCase).should().complete("c1", "u1", PaymentOutcome.APPROVED);
    }

    @Test
    @DisplayName("구매자 헤더 없는 결제 복귀는 HOLDER_REQUIRED")
    void payment_return_without_holder() throws Exception {
        mockMvc.perform(post("/api/payments/c1/return")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"APPROVED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("HOLDER_REQUIRED"));

        then(completePaymentUseCase).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("내부에서 발생한 IllegalArgumentException은 요청 오류가 아니라 500")
    void internal_illegal_argument() throws Exception {
        willThrow(new IllegalArgumentException("필수 필드 누락: holderId"))
                .given(getCheckoutUseCase).getCheckout("c1", "u1");

        mockMvc.perform(get("/api/checkout/c1").header("X-Holder-Id", "u1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    @Test
    @DisplayName("알 수 없는 결제 결과 값은 INVALID_REQUEST")
    void payment_return_invalid_outcome() throws Exception {
        mockMvc.perform(post("/api/payments/c1/return")
                        .header("X-Holder-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"MAYBE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
