package kr.jemi.zcloset.reservation.api;

import kr.jemi.zcloset.common.scope.Subscription;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;

public interface ReservationFacade {

    ReservationResult reserveProducts(Collection<String> productIds, String holderId);

    Set<String> extend(Collection<String> productIds, String holderId);

    void release(Collection<String> productIds, String holderId);

    Set<String> findReservedByOthers(Collection<String> productIds, String viewerHolderId);

    Subscription subscribeReservedByOthers(Collection<String> productIds, String viewerHolderId,
                                           Consumer<Set<String>> callback);

    Duration ttl();

    Duration heartbeatInterval();
}
