package kr.jemi.zcloset.reservation.application.service;

import kr.jemi.zcloset.reservation.domain.Reservation;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 상품별 선점 구독 결과를 모아 "다른 구매자가 잠근 상품" 집합을 계산한다.
 * 구독 등록이 끝나기 전에 들어온 알림은 상태만 반영하고, start() 시점에 한 번 전달한다.
 */
class ReservedByOthersWatch {

    private final Set<String> productIds;
    private final String viewerHolderId;
    private final Clock clock;
    private final Consumer<Set<String>> callback;
    private final Map<String, Reservation> current = new HashMap<>();
    private boolean started;

    ReservedByOthersWatch(Set<String> productIds, String viewerHolderId, Clock clock,
                          Consumer<Set<String>> callback) {
        this.productIds = productIds;
        this.viewerHolderId = viewerHolderId;
        this.clock = clock;
        this.callback = callback;
    }

    void update(String productId, Optional<Reservation> reservation) {
        Set<String> snapshot;
        synchronized (this) {
            reservation.ifPresentOrElse(r -> current.put(productId, r), () -> current.remove(productId));
            if (!started) {
                return;
            }
            snapshot = lockedByOthers();
        }
        callback.accept(snapshot);
    }

    void start() {
        Set<String> snapshot;
        synchronized (this) {
            started = true;
            snapshot = lockedByOthers();
        }
        callback.accept(snapshot);
    }

    private Set<String> lockedByOthers() {
        Set<String> locked = new LinkedHashSet<>();
        for (String productId : productIds) {
            Reservation reservation = current.get(productId);
            if (reservation != null && reservation.blocks(viewerHolderId, clock.instant())) {
                locked.add(productId);
            }
        }
        return Set.copyOf(locked);
    }
}
