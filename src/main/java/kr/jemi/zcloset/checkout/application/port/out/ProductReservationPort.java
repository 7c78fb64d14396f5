package kr.jemi.zcloset.checkout.application.port.out;

import kr.jemi.zcloset.checkout.domain.ReservationAttempt;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;

public interface ProductReservationPort {

    Set<String> findLockedByOthers(Collection<String> productIds, String holderId);

    ReservationAttempt reserve(Collection<String> productIds, String holderId);

    Set<String> extend(Collection<String> productIds, String holderId);

    void release(Collection<String> productIds, String holderId);

    Duration ttl();

    Duration heartbeatInterval();
}
