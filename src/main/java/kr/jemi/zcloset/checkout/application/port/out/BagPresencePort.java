package kr.jemi.zcloset.checkout.application.port.out;

import java.util.Collection;

public interface BagPresencePort {

    void clear(Collection<String> productIds, String holderId);

    void restore(Collection<String> productIds, String holderId);
}
