package kr.jemi.zcloset.availability.application.port.out;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

public interface PresenceWatchPort {

    Set<String> findWanted(Collection<String> productIds, String viewerHolderId);

    RefreshableSubscription watchWanted(Collection<String> productIds, String viewerHolderId,
                                        Supplier<Set<String>> lockedSet, Consumer<Set<String>> onChange);
}
