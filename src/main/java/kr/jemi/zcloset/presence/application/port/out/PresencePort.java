package kr.jemi.zcloset.presence.application.port.out;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.presence.domain.CartPresence;

import java.util.List;

public interface PresencePort {

    void save(CartPresence presence);

    void delete(String productId, String holderId);

    List<CartPresence> findByProduct(String productId);

    Subscription watchProduct(String productId, Runnable onChange);
}
