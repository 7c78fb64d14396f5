package kr.jemi.zcloset.availability.infrastructure.out.reservation;

import kr.jemi.zcloset.availability.application.port.out.ReservationWatchPort;
import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.reservation.api.ReservationFacade;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;

@Component
public class ReservationWatchAdapter implements ReservationWatchPort {

    private final ReservationFacade reservationFacade;

    public ReservationWatchAdapter(ReservationFacade reservationFacade) {
        this.reservationFacade = reservationFacade;
    }

    @Override
    public Set<String> findLocked(Collection<String> productIds, String viewerHolderId) {
        return reservationFacade.findReservedByOthers(productIds, viewerHolderId);
    }

    @Override
    public Subscription watchLocked(Collection<String> productIds, String viewerHolderId,
                                    Consumer<Set<String>> onChange) {
        return reservationFacade.subscribeReservedByOthers(productIds, viewerHolderId, onChange);
    }
}
