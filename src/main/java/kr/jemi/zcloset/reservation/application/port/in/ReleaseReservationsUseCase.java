package kr.jemi.zcloset.reservation.application.port.in;

import java.util.Collection;

public interface ReleaseReservationsUseCase {

    void release(Collection<String> productIds, String holderId);
}
