package kr.jemi.zcloset.checkout.infrastructure.out.reservation;

import kr.jemi.zcloset.checkout.application.port.out.ProductReservationPort;
import kr.jemi.zcloset.checkout.domain.ReservationAttempt;
import kr.jemi.zcloset.reservation.api.ReservationFacade;
import kr.jemi.zcloset.reservation.api.ReservationResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;

@Component
public class ProductReservationAdapter implements ProductReservationPort {

    private final ReservationFacade reservationFacade;

    public ProductReservationAdapter(ReservationFacade reservationFacade) {
        this.reservationFacade = reservationFacade;
    }

    @Override
    public Set<String> findLockedByOthers(Collection<String> productIds, String holderId) {
        return reservationFacade.findReservedByOthers(productIds, holderId);
    }

    @Override
    public ReservationAttempt reserve(Collection<String> productIds, String holderId) {
        ReservationResult result = reservationFacade.reserveProducts(productIds, holderId);
        return new ReservationAttempt(result.reserved(), result.conflicted(), result.failed());
    }

    @Override
    public Set<String> extend(Collection<String> productIds, String holderId) {
        return reservationFacade.extend(productIds, holderId);
    }

    @Override
    public void release(Collection<String> productIds, String holderId) {
        reservationFacade.release(productIds, holderId);
    }

    @Override
    public Duration ttl() {
        return reservationFacade.ttl();
    }

    @Override
    public Duration heartbeatInterval() {
        return reservationFacade.heartbeatInterval();
    }
}
