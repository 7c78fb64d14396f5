package kr.jemi.zcloset.availability.application.port.out;

import kr.jemi.zcloset.common.scope.Subscription;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;

public interface ReservationWatchPort {

    Set<String> findLocked(Collection<String> productIds, String viewerHolderId);

    Subscription watchLocked(Collection<String> productIds, String viewerHolderId, Consumer<Set<String>> onChange);
}
