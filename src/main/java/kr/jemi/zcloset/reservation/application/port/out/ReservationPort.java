package kr.jemi.zcloset.reservation.application.port.out;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.reservation.domain.Reservation;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

public interface ReservationPort {

    Optional<Reservation> find(String productId);

    /**
     * 기존 선점이 없거나 만료되었거나 같은 구매자의 것일 때만 저장한다.
     */
    boolean createIfClaimable(Reservation reservation, Instant now);

    /**
     * 저장된 선점의 보유자가 같을 때만 덮어쓴다.
     */
    boolean renewIfHeldBy(Reservation renewed);

    boolean deleteIfHeldBy(String productId, String holderId);

    Subscription watch(String productId, Consumer<Optional<Reservation>> onChange);
}
