package kr.jemi.zcloset.availability.application.port.in;

import kr.jemi.zcloset.availability.domain.Availability;

import java.util.Collection;
import java.util.function.Consumer;

public interface TrackAvailabilityUseCase {

    Availability snapshot(Collection<String> productIds, String viewerHolderId);

    /**
     * 가용성이 바뀔 때마다 listener를 호출하는 추적기를 연다. 첫 결과는 반환 전에 전달된다.
     */
    AvailabilityTracking track(Collection<String> productIds, String viewerHolderId,
                               Consumer<Availability> listener);

    interface AvailabilityTracking {

        /**
         * 이전 구독을 모두 닫은 뒤 새 상품 목록과 관찰자로 다시 구독한다.
         */
        void retarget(Collection<String> productIds, String viewerHolderId);

        Availability current();

        void unsubscribe();
    }
}
