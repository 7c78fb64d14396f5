package kr.jemi.zcloset.checkout.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcloset.checkout.application.port.in.CompletePaymentUseCase;
import kr.jemi.zcloset.checkout.application.port.in.ContinueCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.EnterCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.GetCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HandOffPaymentUseCase;
import kr.jemi.zcloset.checkout.application.port.in.HeartbeatCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.LeaveCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.in.WatchCheckoutUseCase;
import kr.jemi.zcloset.checkout.application.port.out.BagPresencePort;
import kr.jemi.zcloset.checkout.application.port.out.CheckoutSessionPort;
import kr.jemi.zcloset.checkout.application.port.out.PendingPaymentPort;
import kr.jemi.zcloset.checkout.application.port.out.ProductReservationPort;
import kr.jemi.zcloset.checkout.domain.CheckoutCompletedEvent;
import kr.jemi.zcloset.checkout.domain.CheckoutPhase;
import kr.jemi.zcloset.checkout.domain.CheckoutSession;
import kr.jemi.zcloset.checkout.domain.CheckoutStatus;
import kr.jemi.zcloset.checkout.domain.PaymentOutcome;
import kr.jemi.zcloset.checkout.domain.PendingPayment;
import kr.jemi.zcloset.checkout.domain.ReservationAttempt;
import kr.jemi.zcloset.common.exception.BusinessException;
import kr.jemi.zcloset.common.exception.ErrorCode;
import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.scope.SubscriptionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static kr.jemi.zcloset.common.validation.ValidationUtils.distinctIds;
import static kr.jemi.zcloset.common.validation.ValidationUtils.isBlank;

@Service
public class CheckoutService implements EnterCheckoutUseCase, GetCheckoutUseCase, HeartbeatCheckoutUseCase,
        ContinueCheckoutUseCase, LeaveCheckoutUseCase, HandOffPaymentUseCase, CompletePaymentUseCase,
        WatchCheckoutUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final ProductReservationPort productReservationPort;
    private final BagPresencePort bagPresencePort;
    private final CheckoutSessionPort checkoutSessionPort;
    private final PendingPaymentPort pendingPaymentPort;
    private final CheckoutTimer checkoutTimer;
    private final ApplicationEventPublisher eventPublisher;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final Duration grace;

    // 세션별 타이머와 스트림 구독
    private final Map<String, SubscriptionScope> scopes = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<CheckoutStatus>>> listeners = new ConcurrentHashMap<>();

    public CheckoutService(ProductReservationPort productReservationPort,
                           BagPresencePort bagPresencePort,
                           CheckoutSessionPort checkoutSessionPort,
                           PendingPaymentPort pendingPaymentPort,
                           CheckoutTimer checkoutTimer,
                           ApplicationEventPublisher eventPublisher,
                           TSID.Factory tsidFactory,
                           Clock clock,
                           @Value("${zcloset.checkout.grace-seconds}") long graceSeconds) {
        this.productReservationPort = productReservationPort;
        this.bagPresencePort = bagPresencePort;
        this.checkoutSessionPort = checkoutSessionPort;
        this.pendingPaymentPort = pendingPaymentPort;
        this.checkoutTimer = checkoutTimer;
        this.eventPublisher = eventPublisher;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.grace = Duration.ofSeconds(graceSeconds);
    }

    @Override
    public CheckoutStatus enter(String holderId, Collection<String> productIds) {
        if (isBlank(holderId)) {
            throw new BusinessException(ErrorCode.HOLDER_REQUIRED);
        }
        Set<String> ids = distinctIds(productIds);
        Set<String> purchasable = new LinkedHashSet<>(ids);
        if (!ids.isEmpty()) {
            purchasable.removeAll(productReservationPort.findLockedByOthers(ids, holderId));
        }
        if (purchasable.isEmpty()) {
            throw new BusinessException(ErrorCode.NOTHING_TO_CHECKOUT);
        }

        CheckoutSession session = CheckoutSession.begin(tsidFactory.generate().encode(62), holderId,
                purchasable, productReservationPort.ttl(), grace, clock.instant());

        // 선점은 구매자 단위이므로 같은 구매자의 세션 두 개가 한 선점을 나눠 갖지 않게 한다
        if (!checkoutSessionPort.register(session)) {
            log.info("진행 중인 체크아웃과 상품이 겹쳐 진입 거부: holderId={}, productIds={}", holderId, purchasable);
            throw new BusinessException(ErrorCode.CHECKOUT_IN_PROGRESS);
        }

        ReservationAttempt attempt;
        try {
            // 1. 결제할 상품은 장바구니 신호에서 제외
            bagPresencePort.clear(purchasable, holderId);

            // 2. 상품별 조건부 선점
            attempt = productReservationPort.reserve(purchasable, holderId);
        } catch (RuntimeException e) {
            checkoutSessionPort.delete(session.getId());
            throw e;
        }

        // 3. 선점하지 못한 상품은 장바구니로 복구
        Set<String> lost = new LinkedHashSet<>(purchasable);
        lost.removeAll(attempt.reserved());
        if (!lost.isEmpty()) {
            bagPresencePort.restore(lost, holderId);
        }
        if (attempt.reserved().isEmpty()) {
            checkoutSessionPort.delete(session.getId());
            log.info("체크아웃 진입 실패: holderId={}, conflicted={}, failed={}",
                    holderId, attempt.conflicted(), attempt.failed());
            throw new BusinessException(attempt.conflicted().isEmpty()
                    ? ErrorCode.CHECKOUT_UNAVAILABLE
                    : ErrorCode.PRODUCT_ALREADY_RESERVED);
        }

        // 4. 카운트다운 시작
        CheckoutStatus status;
        synchronized (session) {
            Instant now = clock.instant();
            session.activate(attempt.reserved(), now);
            checkoutSessionPort.save(session);
            startTimer(session.getId());
            status = session.statusAt(now);
        }
        log.info("체크아웃 시작: checkoutId={}, holderId={}, reserved={}, lost={}",
                session.getId(), holderId, attempt.reserved(), lost);
        return status;
    }

    @Override
    public CheckoutStatus getCheckout(String checkoutId, String holderId) {
        CheckoutSession session = findOwned(checkoutId, holderId);
        synchronized (session) {
            Instant now = clock.instant();
            session.touch(now);
            return session.statusAt(now);
        }
    }

    @Override
    public CheckoutStatus heartbeat(String checkoutId, String holderId) {
        CheckoutSession session = findOwned(checkoutId, holderId);
        synchronized (session) {
            if (!session.isInProgress()) {
                throw new BusinessException(ErrorCode.INVALID_CHECKOUT_STATE);
            }
            Instant now = clock.instant();
            session.touch(now);
            // WARNING 상태에서는 구매자의 명시적인 응답(continue)이 있어야 연장한다
            if (session.getPhase() == CheckoutPhase.ACTIVE) {
                renewReservations(session, now);
            }
            notifyListeners(session, now);
            return session.statusAt(now);
        }
    }

    @Override
    public CheckoutStatus continueCheckout(String checkoutId, String holderId) {
        CheckoutSession session = findOwned(checkoutId, holderId);
        synchronized (session) {
            if (!session.isInProgress()) {
                throw new BusinessException(ErrorCode.INVALID_CHECKOUT_STATE);
            }
            Instant now = clock.instant();
            session.touch(now);
            if (!renewReservations(session, now)) {
                log.info("연장 가능한 선점이 없어 체크아웃 종료: checkoutId={}", checkoutId);
                releaseSession(session, now);
                throw new BusinessException(ErrorCode.CHECKOUT_EXPIRED);
            }
            notifyListeners(session, now);
            return session.statusAt(now);
        }
    }

    @Override
    public void leave(String checkoutId, String holderId) {
        if (isBlank(holderId)) {
            throw new BusinessException(ErrorCode.HOLDER_REQUIRED);
        }
        Optional<CheckoutSession> found = checkoutSessionPort.findById(checkoutId);
        if (found.isEmpty()) {
            log.debug("이미 종료된 체크아웃: checkoutId={}", checkoutId);
            return;
        }
        CheckoutSession session = found.get();
        if (!session.isOwnedBy(holderId)) {
            throw new BusinessException(ErrorCode.CHECKOUT_NOT_OWNED);
        }
        synchronized (session) {
            if (session.getPhase() == CheckoutPhase.REDIRECTED) {
                log.debug("결제 진행 중인 체크아웃은 이탈 시 해제하지 않음: checkoutId={}", checkoutId);
                return;
            }
            releaseSession(session, clock.instant());
        }
    }

    @Override
    public PendingPayment handOff(String checkoutId, String holderId) {
        CheckoutSession session = findOwned(checkoutId, holderId);
        synchronized (session) {
            if (session.getPhase() != CheckoutPhase.ACTIVE) {
                throw new BusinessException(ErrorCode.INVALID_CHECKOUT_STATE);
            }
            Instant now = clock.instant();
            // 외부 결제 동안 선점이 유지되도록 한 번 더 연장하고, 연장된 상품만 결제한다
            Set<String> paying = productReservationPort.extend(session.getReservedProductIds(), holderId);
            if (paying.isEmpty()) {
                throw new BusinessException(ErrorCode.CHECKOUT_UNAVAILABLE);
            }
            PendingPayment pendingPayment = new PendingPayment(checkoutId, holderId, paying, now);
            pendingPaymentPort.save(pendingPayment);

            session.redirectToPayment(now);
            notifyListeners(session, now);
            closeScope(checkoutId);
            // 결제사에서 돌아오지 않는 세션을 정리하기 위해 타이머는 계속 돌린다
            startTimer(checkoutId);
            log.info("결제사로 이동: checkoutId={}, productIds={}", checkoutId, paying);
            return pendingPayment;
        }
    }

    @Override
    public void complete(String reference, String holderId, PaymentOutcome outcome) {
        if (isBlank(holderId)) {
            throw new BusinessException(ErrorCode.HOLDER_REQUIRED);
        }
        PendingPayment pendingPayment = pendingPaymentPort.find(reference)
                .orElseThrow(() -> new BusinessException(ErrorCode.PENDING_PAYMENT_NOT_FOUND));
        if (!pendingPayment.holderId().equals(holderId)) {
            log.warn("결제를 시작하지 않은 구매자의 결제 복귀: reference={}, holderId={}", reference, holderId);
            throw new BusinessException(ErrorCode.CHECKOUT_NOT_OWNED);
        }

        Optional<CheckoutSession> found = checkoutSessionPort.findById(reference);
        if (found.isEmpty()) {
            settle(pendingPayment, outcome);
            return;
        }
        CheckoutSession session = found.get();
        synchronized (session) {
            if (session.getPhase() != CheckoutPhase.REDIRECTED) {
                // 결제 대기 시간이 지나 이미 정리된 세션
                throw new BusinessException(ErrorCode.PENDING_PAYMENT_NOT_FOUND);
            }
            settle(pendingPayment, outcome);
            session.complete();
        }
        checkoutSessionPort.delete(reference);
        closeScope(reference);
    }

    private void settle(PendingPayment pendingPayment, PaymentOutcome outcome) {
        String reference = pendingPayment.reference();
        Set<String> productIds = pendingPayment.productIds();
        String holderId = pendingPayment.holderId();

        if (outcome == PaymentOutcome.APPROVED) {
            eventPublisher.publishEvent(new CheckoutCompletedEvent(reference, holderId, productIds));
            productReservationPort.release(productIds, holderId);
            bagPresencePort.clear(productIds, holderId);
        } else {
            productReservationPort.release(productIds, holderId);
            bagPresencePort.restore(productIds, holderId);
        }
        pendingPaymentPort.delete(reference);
        log.info("결제 결과 처리: reference={}, outcome={}, productIds={}", reference, outcome, productIds);
    }

    @Override
    public Subscription watch(String checkoutId, String holderId, Consumer<CheckoutStatus> listener) {
        CheckoutSession session = findOwned(checkoutId, holderId);
        synchronized (session) {
            Instant now = clock.instant();
            listener.accept(session.statusAt(now));
            SubscriptionScope scope = scopes.get(checkoutId);
            if (!session.isInProgress() || scope == null) {
                return Subscription.NOOP;
            }
            session.attachWatcher();
            listeners.computeIfAbsent(checkoutId, id -> new CopyOnWriteArrayList<>()).add(listener);
            AtomicBoolean cancelled = new AtomicBoolean();
            return scope.add(() -> {
                if (!cancelled.compareAndSet(false, true)) {
                    return;
                }
                listeners.getOrDefault(checkoutId, List.of()).remove(listener);
                synchronized (session) {
                    session.detachWatcher();
                }
            });
        }
    }

    /**
     * 카운트다운 tick. 구매자가 화면에 머무는 동안 heartbeat 간격마다 선점을 연장하고,
     * 카운트다운이 끝나면 WARNING으로, 유예 시간이 끝나면 자동 해제한다.
     * 결제사로 넘어간 세션은 결제 대기 시간이 지나면 정리한다.
     */
    public void tick(String checkoutId) {
        Optional<CheckoutSession> found = checkoutSessionPort.findById(checkoutId);
        if (found.isEmpty()) {
            closeScope(checkoutId);
            return;
        }
        CheckoutSession session = found.get();
        synchronized (session) {
            Instant now = clock.instant();
            if (session.getPhase() == CheckoutPhase.REDIRECTED) {
                if (session.abandonPaymentIfOverdue(now)) {
                    abandonPayment(session);
                }
                return;
            }
            if (!session.isInProgress()) {
                return;
            }
            Duration heartbeatInterval = productReservationPort.heartbeatInterval();
            if (session.isHeartbeatDue(now, heartbeatInterval) && session.isAttended(now, heartbeatInterval)) {
                renewReservations(session, now);
            }
            if (session.expireIfDue(now)) {
                log.info("카운트다운 종료, 유예 시작: checkoutId={}", checkoutId);
            }
            if (session.isGraceOver(now)) {
                log.info("유예 시간 초과, 자동 해제: checkoutId={}", checkoutId);
                releaseSession(session, now);
                return;
            }
            notifyListeners(session, now);
        }
    }

    private boolean renewReservations(CheckoutSession session, Instant now) {
        Set<String> extended = productReservationPort.extend(session.getReservedProductIds(), session.getHolderId());
        if (extended.isEmpty()) {
            log.warn("선점 연장 실패, 다음 주기에 재시도: checkoutId={}", session.getId());
            return false;
        }
        session.renew(now);
        return true;
    }

    private void releaseSession(CheckoutSession session, Instant now) {
        if (!session.release()) {
            return;
        }
        Set<String> reserved = session.getReservedProductIds();
        productReservationPort.release(reserved, session.getHolderId());
        bagPresencePort.restore(reserved, session.getHolderId());
        notifyListeners(session, now);
        checkoutSessionPort.delete(session.getId());
        closeScope(session.getId());
        log.info("체크아웃 해제: checkoutId={}, productIds={}", session.getId(), reserved);
    }

    private void abandonPayment(CheckoutSession session) {
        String checkoutId = session.getId();
        pendingPaymentPort.find(checkoutId).ifPresent(pendingPayment -> {
            productReservationPort.release(pendingPayment.productIds(), pendingPayment.holderId());
            bagPresencePort.restore(pendingPayment.productIds(), pendingPayment.holderId());
            pendingPaymentPort.delete(checkoutId);
        });
        checkoutSessionPort.delete(checkoutId);
        closeScope(checkoutId);
        log.info("결제 결과 없이 결제 대기 시간 초과, 세션 정리: checkoutId={}", checkoutId);
    }

    private void startTimer(String checkoutId) {
        SubscriptionScope scope = new SubscriptionScope();
        scopes.put(checkoutId, scope);
        scope.add(checkoutTimer.start(checkoutId, () -> tick(checkoutId)));
    }

    private void closeScope(String checkoutId) {
        SubscriptionScope scope = scopes.remove(checkoutId);
        if (scope != null) {
            scope.close();
        }
        listeners.remove(checkoutId);
    }

    private void notifyListeners(CheckoutSession session, Instant now) {
        CheckoutStatus status = session.statusAt(now);
        for (Consumer<CheckoutStatus> listener : listeners.getOrDefault(session.getId(), List.of())) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("체크아웃 상태 전달 실패: checkoutId={}", session.getId(), e);
            }
        }
    }

    private CheckoutSession findOwned(String checkoutId, String holderId) {
        if (isBlank(holderId)) {
            throw new BusinessException(ErrorCode.HOLDER_REQUIRED);
        }
        CheckoutSession session = checkoutSessionPort.findById(checkoutId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHECKOUT_NOT_FOUND));
        if (!session.isOwnedBy(holderId)) {
            throw new BusinessException(ErrorCode.CHECKOUT_NOT_OWNED);
        }
        return session;
    }
}
