package kr.jemi.zcloset.availability.infrastructure.out.presence;

import kr.jemi.zcloset.availability.application.port.out.PresenceWatchPort;
import kr.jemi.zcloset.common.scope.RefreshableSubscription;
import kr.jemi.zcloset.presence.api.PresenceFacade;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Component
public class PresenceWatchAdapter implements PresenceWatchPort {

    private final PresenceFacade presenceFacade;

    public PresenceWatchAdapter(PresenceFacade presenceFacade) {
        this.presenceFacade = presenceFacade;
    }

    @Override
    public Set<String> findWanted(Collection<String> productIds, String viewerHolderId) {
        return presenceFacade.findWantedByOthers(productIds, viewerHolderId);
    }

    @Override
    public RefreshableSubscription watchWanted(Collection<String> productIds, String viewerHolderId,
                                               Supplier<Set<String>> lockedSet, Consumer<Set<String>> onChange) {
        return presenceFacade.subscribeWantedByOthers(productIds, viewerHolderId, lockedSet, onChange);
    }
}
