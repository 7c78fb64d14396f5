package kr.jemi.zcloset.presence.application.service;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;
import kr.jemi.zcloset.common.scope.SubscriptionScope;
import kr.jemi.zcloset.presence.application.port.out.PresencePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 상품별 장바구니 신호를 구독하고, 변경이 오면 전체 상품을 다시 조회해 "다른 구매자가 원하는 상품" 집합을 전달한다.
 * 조회에 실패한 상품은 직전 값을 유지한다.
 */
class WantedByOthersWatch implements RefreshableSubscription {

    private static final Logger log = LoggerFactory.getLogger(WantedByOthersWatch.class);

    private final Set<String> productIds;
    private final String viewerHolderId;
    private final Supplier<Set<String>> lockedSet;
    private final Consumer<Set<String>> callback;
    private final PresencePort presencePort;
    private final SubscriptionScope scope = new SubscriptionScope();
    private final Map<String, Boolean> wantedByProduct = new HashMap<>();
    private boolean ready;

    WantedByOthersWatch(Set<String> productIds, String viewerHolderId, Supplier<Set<String>> lockedSet,
                        Consumer<Set<String>> callback, PresencePort presencePort) {
        this.productIds = productIds;
        this.viewerHolderId = viewerHolderId;
        this.lockedSet = lockedSet;
        this.callback = callback;
        this.presencePort = presencePort;
    }

    void open() {
        for (String productId : productIds) {
            try {
                scope.add(presencePort.watchProduct(productId, this::recheck));
            } catch (RuntimeException e) {
                log.warn("장바구니 구독 실패: productId={}", productId, e);
            }
        }
        synchronized (this) {
            ready = true;
        }
        recheck();
    }

    @Override
    public void refresh() {
        recheck();
    }

    @Override
    public void cancel() {
        scope.close();
    }

    private void recheck() {
        Set<String> wanted;
        synchronized (this) {
            if (!ready || scope.isClosed()) {
                return;
            }
            for (String productId : productIds) {
                try {
                    boolean wantedByOthers = presencePort.findByProduct(productId).stream()
                            .anyMatch(presence -> !presence.isHeldBy(viewerHolderId));
                    wantedByProduct.put(productId, wantedByOthers);
                } catch (RuntimeException e) {
                    log.warn("장바구니 조회 실패, 이전 값 유지: productId={}", productId, e);
                }
            }
            Set<String> locked = lockedSet.get();
            wanted = new LinkedHashSet<>();
            for (String productId : productIds) {
                if (wantedByProduct.getOrDefault(productId, false) && !locked.contains(productId)) {
                    wanted.add(productId);
                }
            }
        }
        callback.accept(Set.copyOf(wanted));
    }
}
