package kr.jemi.zcloset.reservation.application.port.in;

import kr.jemi.zcloset.common.scope.Subscription;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;

public interface WatchReservationsUseCase {

    Set<String> findReservedByOthers(Collection<String> productIds, String viewerHolderId);

    Subscription subscribeReservedByOthers(Collection<String> productIds, String viewerHolderId,
                                           Consumer<Set<String>> callback);
}
