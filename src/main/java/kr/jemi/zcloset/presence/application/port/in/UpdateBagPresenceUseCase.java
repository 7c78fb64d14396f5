package kr.jemi.zcloset.presence.application.port.in;

import java.util.Collection;

public interface UpdateBagPresenceUseCase {

    void setPresent(String productId, String holderId);

    void clearPresent(String productId, String holderId);

    void clearPresentBatch(Collection<String> productIds, String holderId);

    void restorePresentBatch(Collection<String> productIds, String holderId);
}
