package kr.jemi.zcloset.availability.application.service;

import kr.jemi.zcloset.availability.application.port.in.TrackAvailabilityUseCase.AvailabilityTracking;
import kr.jemi.zcloset.availability.application.port.out.PresenceWatchPort;
import kr.jemi.zcloset.availability.application.port.out.ReservationWatchPort;
import kr.jemi.zcloset.availability.domain.Availability;
import kr.jemi.zcloset.common.scope.RefreshableSubscription;
import kr.jemi.zcloset.common.scope.SubscriptionScope;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 선점 구독과 장바구니 구독을 합쳐 관찰자 한 명의 가용성을 유지한다.
 * <p>
 * retarget() 할 때마다 세대 번호가 올라가고, 이전 세대 구독에서 늦게 도착한 알림은 버린다.
 * 구독을 여는 동안 들어온 알림은 상태에만 반영하고, 구독이 모두 열린 뒤 한 번 전달한다.
 * 잠긴 상품 집합이 바뀌면 장바구니 구독을 refresh 해서 WANTED 판정을 다시 한다.
 */
class AvailabilityTracker implements AvailabilityTracking {

    private final ReservationWatchPort reservationWatchPort;
    private final PresenceWatchPort presenceWatchPort;
    private final Consumer<Availability> listener;

    private SubscriptionScope scope = new SubscriptionScope();
    private RefreshableSubscription wantedSubscription = RefreshableSubscription.NOOP;
    private long generation;
    private boolean ready;
    private volatile Set<String> locked = Set.of();
    private Set<String> wanted = Set.of();
    private Availability current = Availability.empty();

    AvailabilityTracker(ReservationWatchPort reservationWatchPort,
                        PresenceWatchPort presenceWatchPort,
                        Consumer<Availability> listener) {
        this.reservationWatchPort = reservationWatchPort;
        this.presenceWatchPort = presenceWatchPort;
        this.listener = listener;
    }

    @Override
    public void retarget(Collection<String> productIds, String viewerHolderId) {
        SubscriptionScope previous;
        SubscriptionScope next = new SubscriptionScope();
        long gen;
        synchronized (this) {
            previous = scope;
            scope = next;
            gen = ++generation;
            ready = false;
            wantedSubscription = RefreshableSubscription.NOOP;
            locked = Set.of();
            wanted = Set.of();
        }
        previous.close();

        next.add(reservationWatchPort.watchLocked(productIds, viewerHolderId, set -> onLocked(gen, set)));
        RefreshableSubscription wantedSub = next.add(presenceWatchPort.watchWanted(
                productIds, viewerHolderId, () -> locked, set -> onWanted(gen, set)));
        synchronized (this) {
            if (gen != generation) {
                return;
            }
            wantedSubscription = wantedSub;
            ready = true;
            current = Availability.of(locked, wanted);
            listener.accept(current);
        }
    }

    @Override
    public synchronized Availability current() {
        return current;
    }

    @Override
    public void unsubscribe() {
        SubscriptionScope toClose;
        synchronized (this) {
            generation++;
            toClose = scope;
            wantedSubscription = RefreshableSubscription.NOOP;
        }
        toClose.close();
    }

    private void onLocked(long gen, Set<String> lockedByOthers) {
        RefreshableSubscription toRefresh;
        synchronized (this) {
            if (gen != generation) {
                return;
            }
            locked = Set.copyOf(lockedByOthers);
            toRefresh = wantedSubscription;
        }
        publish(gen);
        toRefresh.refresh();
    }

    private void onWanted(long gen, Set<String> wantedByOthers) {
        synchronized (this) {
            if (gen != generation) {
                return;
            }
            wanted = Set.copyOf(wantedByOthers);
        }
        publish(gen);
    }

    private synchronized void publish(long gen) {
        if (gen != generation || !ready) {
            return;
        }
        Availability next = Availability.of(locked, wanted);
        if (next.equals(current)) {
            return;
        }
        current = next;
        listener.accept(next);
    }
}
