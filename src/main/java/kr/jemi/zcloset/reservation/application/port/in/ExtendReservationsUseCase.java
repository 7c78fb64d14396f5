package kr.jemi.zcloset.reservation.application.port.in;

import java.util.Collection;
import java.util.Set;

public interface ExtendReservationsUseCase {

    /**
     * 본인이 보유한 선점만 만료 시각을 갱신한다. 실제로 연장된 상품 ID를 반환한다.
     */
    Set<String> extend(Collection<String> productIds, String holderId);
}
