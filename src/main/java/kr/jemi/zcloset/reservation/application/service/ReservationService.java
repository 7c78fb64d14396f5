package kr.jemi.zcloset.reservation.application.service;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.scope.SubscriptionScope;
import kr.jemi.zcloset.reservation.api.ReservationFacade;
import kr.jemi.zcloset.reservation.api.ReservationResult;
import kr.jemi.zcloset.reservation.application.port.in.ExtendReservationsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.ReleaseReservationsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.ReserveProductsUseCase;
import kr.jemi.zcloset.reservation.application.port.in.WatchReservationsUseCase;
import kr.jemi.zcloset.reservation.application.port.out.ReservationPort;
import kr.jemi.zcloset.reservation.domain.Reservation;
import kr.jemi.zcloset.reservation.domain.ReserveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static kr.jemi.zcloset.common.validation.ValidationUtils.distinctIds;
import static kr.jemi.zcloset.common.validation.ValidationUtils.isBlank;

@Service
public class ReservationService implements ReserveProductsUseCase, ExtendReservationsUseCase,
        ReleaseReservationsUseCase, WatchReservationsUseCase, ReservationFacade {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final ReservationPort reservationPort;
    private final Clock clock;
    private final Duration ttl;
    private final Duration heartbeatInterval;

    public ReservationService(ReservationPort reservationPort,
                              Clock clock,
                              @Value("${zcloset.reservation.ttl-seconds}") long ttlSeconds,
                              @Value("${zcloset.reservation.heartbeat-interval-seconds}") long heartbeatIntervalSeconds) {
        this.reservationPort = reservationPort;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.heartbeatInterval = Duration.ofSeconds(heartbeatIntervalSeconds);
    }

    @Override
    public ReserveOutcome reserve(Collection<String> productIds, String holderId) {
        Set<String> ids = distinctIds(productIds);
        if (ids.isEmpty() || isBlank(holderId)) {
            return ReserveOutcome.empty();
        }
        Instant now = clock.instant();
        Set<String> reserved = new LinkedHashSet<>();
        Set<String> conflicted = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        for (String productId : ids) {
            try {
                if (reservationPort.createIfClaimable(Reservation.issue(productId, holderId, now, ttl), now)) {
                    reserved.add(productId);
                } else {
                    log.info("다른 구매자가 이미 선점한 상품: productId={}", productId);
                    conflicted.add(productId);
                }
            } catch (RuntimeException e) {
                log.warn("상품 선점 실패: productId={}", productId, e);
                failed.add(productId);
            }
        }
        return new ReserveOutcome(reserved, conflicted, failed);
    }

    @Override
    public ReservationResult reserveProducts(Collection<String> productIds, String holderId) {
        ReserveOutcome outcome = reserve(productIds, holderId);
        return new ReservationResult(outcome.reserved(), outcome.conflicted(), outcome.failed());
    }

    @Override
    public Set<String> extend(Collection<String> productIds, String holderId) {
        Set<String> ids = distinctIds(productIds);
        if (ids.isEmpty() || isBlank(holderId)) {
            return Set.of();
        }
        Instant now = clock.instant();
        Set<String> extended = new LinkedHashSet<>();
        for (String productId : ids) {
            try {
                Optional<Reservation> current = reservationPort.find(productId);
                if (current.isEmpty() || !current.get().isHeldBy(holderId)) {
                    log.debug("보유하지 않은 선점은 연장하지 않음: productId={}", productId);
                    continue;
                }
                if (reservationPort.renewIfHeldBy(current.get().renew(now, ttl))) {
                    extended.add(productId);
                } else {
                    log.debug("연장 중 선점 보유자 변경: productId={}", productId);
                }
            } catch (RuntimeException e) {
                log.warn("선점 연장 실패: productId={}", productId, e);
            }
        }
        return Set.copyOf(extended);
    }

    @Override
    public void release(Collection<String> productIds, String holderId) {
        Set<String> ids = distinctIds(productIds);
        if (ids.isEmpty() || isBlank(holderId)) {
            return;
        }
        for (String productId : ids) {
            try {
                if (!reservationPort.deleteIfHeldBy(productId, holderId)) {
                    log.debug("보유하지 않은 선점은 해제하지 않음: productId={}", productId);
                }
            } catch (RuntimeException e) {
                log.warn("선점 해제 실패: productId={}", productId, e);
            }
        }
    }

    @Override
    public Set<String> findReservedByOthers(Collection<String> productIds, String viewerHolderId) {
        Instant now = clock.instant();
        Set<String> locked = new LinkedHashSet<>();
        for (String productId : distinctIds(productIds)) {
            try {
                reservationPort.find(productId)
                        .filter(reservation -> reservation.blocks(viewerHolderId, now))
                        .ifPresent(reservation -> locked.add(productId));
            } catch (RuntimeException e) {
                log.warn("선점 조회 실패: productId={}", productId, e);
            }
        }
        return Set.copyOf(locked);
    }

    @Override
    public Subscription subscribeReservedByOthers(Collection<String> productIds, String viewerHolderId,
                                                  Consumer<Set<String>> callback) {
        Set<String> ids = distinctIds(productIds);
        if (ids.isEmpty()) {
            callback.accept(Set.of());
            return Subscription.NOOP;
        }
        ReservedByOthersWatch watch = new ReservedByOthersWatch(ids, viewerHolderId, clock, callback);
        SubscriptionScope scope = new SubscriptionScope();
        for (String productId : ids) {
            try {
                scope.add(reservationPort.watch(productId, reservation -> watch.update(productId, reservation)));
            } catch (RuntimeException e) {
                log.warn("선점 구독 실패: productId={}", productId, e);
            }
        }
        watch.start();
        return scope::close;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }
}
