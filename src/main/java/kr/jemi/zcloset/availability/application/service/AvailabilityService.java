package kr.jemi.zcloset.availability.application.service;

import kr.jemi.zcloset.availability.application.port.in.TrackAvailabilityUseCase;
import kr.jemi.zcloset.availability.application.port.out.PresenceWatchPort;
import kr.jemi.zcloset.availability.application.port.out.ReservationWatchPort;
import kr.jemi.zcloset.availability.domain.Availability;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.function.Consumer;

@Service
public class AvailabilityService implements TrackAvailabilityUseCase {

    private final ReservationWatchPort reservationWatchPort;
    private final PresenceWatchPort presenceWatchPort;

    public AvailabilityService(ReservationWatchPort reservationWatchPort, PresenceWatchPort presenceWatchPort) {
        this.reservationWatchPort = reservationWatchPort;
        this.presenceWatchPort = presenceWatchPort;
    }

    @Override
    public Availability snapshot(Collection<String> productIds, String viewerHolderId) {
        return Availability.of(
                reservationWatchPort.findLocked(productIds, viewerHolderId),
                presenceWatchPort.findWanted(productIds, viewerHolderId));
    }

    @Override
    public AvailabilityTracking track(Collection<String> productIds, String viewerHolderId,
                                      Consumer<Availability> listener) {
        AvailabilityTracker tracker = new AvailabilityTracker(reservationWatchPort, presenceWatchPort, listener);
        tracker.retarget(productIds, viewerHolderId);
        return tracker;
    }
}
