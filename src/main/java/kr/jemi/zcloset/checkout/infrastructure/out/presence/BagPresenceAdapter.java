package kr.jemi.zcloset.checkout.infrastructure.out.presence;

import kr.jemi.zcloset.checkout.application.port.out.BagPresencePort;
import kr.jemi.zcloset.presence.api.PresenceFacade;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class BagPresenceAdapter implements BagPresencePort {

    private final PresenceFacade presenceFacade;

    public BagPresenceAdapter(PresenceFacade presenceFacade) {
        this.presenceFacade = presenceFacade;
    }

    @Override
    public void clear(Collection<String> productIds, String holderId) {
        presenceFacade.clearPresentBatch(productIds, holderId);
    }

    @Override
    public void restore(Collection<String> productIds, String holderId) {
        presenceFacade.restorePresentBatch(productIds, holderId);
    }
}
