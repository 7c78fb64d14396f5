package kr.jemi.zcloset.presence.application.port.in;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

public interface WatchWantedUseCase {

    Set<String> findWantedByOthers(Collection<String> productIds, String viewerHolderId);

    /**
     * 다른 구매자의 장바구니에 담겨 있고 lockedSet에 포함되지 않은 상품 집합을 구독한다.
     * lockedSet이 바뀌면 반환된 구독의 refresh()를 호출해야 한다.
     */
    RefreshableSubscription subscribeWantedByOthers(Collection<String> productIds, String viewerHolderId,
                                                    Supplier<Set<String>> lockedSet,
                                                    Consumer<Set<String>> callback);
}
