package kr.jemi.zcloset.presence.api;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

public interface PresenceFacade {

    void setPresent(String productId, String holderId);

    void clearPresent(String productId, String holderId);

    void clearPresentBatch(Collection<String> productIds, String holderId);

    void restorePresentBatch(Collection<String> productIds, String holderId);

    Set<String> findWantedByOthers(Collection<String> productIds, String viewerHolderId);

    RefreshableSubscription subscribeWantedByOthers(Collection<String> productIds, String viewerHolderId,
                                                    Supplier<Set<String>> lockedSet,
                                                    Consumer<Set<String>> callback);
}
