package kr.jemi.zcloset.checkout.application.port.in;

public interface LeaveCheckoutUseCase {

    /**
     * 선점을 해제하고 장바구니 신호를 복구한다. 여러 번 호출해도 안전하고, 결제사로 넘어간 세션에는 아무 일도 하지 않는다.
     */
    void leave(String checkoutId, String holderId);
}
