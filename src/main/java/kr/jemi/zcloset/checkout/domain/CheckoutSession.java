package kr.jemi.zcloset.checkout.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcloset.common.validation.SelfValidating;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * 구매자 한 명의 체크아웃 시도.
 * <p>
 * IDLE → RESERVING → ACTIVE → WARNING → (ACTIVE | IDLE) 순서로 진행하고, 결제사로 넘어가면 REDIRECTED가 된다.
 * ACTIVE 상태의 카운트다운이 0이 되면 WARNING으로 바뀌고 유예 시간이 시작된다.
 * REDIRECTED 상태에서 TTL과 유예 시간이 모두 지나도록 결제 결과가 오지 않으면 결제를 포기한 것으로 본다.
 * 상태를 바꾸는 메서드는 호출자가 이 객체로 동기화한 상태에서 호출해야 한다.
 */
public class CheckoutSession implements SelfValidating {

    @NotBlank
    private final String id;
    @NotBlank
    private final String holderId;
    @NotEmpty
    private final Set<String> productIds;
    @NotNull
    private final Duration ttl;
    @NotNull
    private final Duration grace;

    private volatile CheckoutPhase phase;
    private volatile Set<String> reservedProductIds = Set.of();
    private Instant deadline;
    private Instant graceDeadline;
    private Instant paymentDeadline;
    private Instant lastActivityAt;
    private Instant lastHeartbeatAt;
    private int attachedWatchers;

    private CheckoutSession(String id, String holderId, Set<String> productIds,
                            Duration ttl, Duration grace, Instant now) {
        this.id = id;
        this.holderId = holderId;
        this.productIds = productIds == null ? null : Set.copyOf(productIds);
        this.ttl = ttl;
        this.grace = grace;
        this.phase = CheckoutPhase.RESERVING;
        this.lastActivityAt = now;
        validateSelf();
    }

    public static CheckoutSession begin(String id, String holderId, Set<String> productIds,
                                       Duration ttl, Duration grace, Instant now) {
        return new CheckoutSession(id, holderId, productIds, ttl, grace, now);
    }

    public void activate(Set<String> reserved, Instant now) {
        requirePhase(CheckoutPhase.RESERVING);
        if (reserved.isEmpty()) {
            throw new IllegalArgumentException("선점한 상품 없이 체크아웃을 시작할 수 없습니다");
        }
        this.reservedProductIds = Set.copyOf(reserved);
        this.phase = CheckoutPhase.ACTIVE;
        this.deadline = now.plus(ttl);
        this.lastHeartbeatAt = now;
    }

    /**
     * 연장에 성공했을 때 호출한다. 남은 시간과 무관하게 카운트다운을 TTL 전체로 되돌린다.
     */
    public void renew(Instant now) {
        if (!isInProgress()) {
            throw new IllegalStateException("진행 중인 체크아웃만 연장할 수 있습니다: " + phase);
        }
        this.phase = CheckoutPhase.ACTIVE;
        this.deadline = now.plus(ttl);
        this.graceDeadline = null;
        this.lastHeartbeatAt = now;
    }

    /**
     * 카운트다운이 끝났으면 WARNING으로 전환하고 유예 시간을 시작한다. 전환했으면 true.
     */
    public boolean expireIfDue(Instant now) {
        if (phase != CheckoutPhase.ACTIVE || now.isBefore(deadline)) {
            return false;
        }
        this.phase = CheckoutPhase.WARNING;
        this.graceDeadline = now.plus(grace);
        return true;
    }

    public boolean isGraceOver(Instant now) {
        return phase == CheckoutPhase.WARNING && !now.isBefore(graceDeadline);
    }

    public boolean isHeartbeatDue(Instant now, Duration heartbeatInterval) {
        return phase == CheckoutPhase.ACTIVE && !now.isBefore(lastHeartbeatAt.plus(heartbeatInterval));
    }

    /**
     * 스트림이 연결되어 있거나 최근 heartbeat 간격 안에 요청이 있었으면 구매자가 화면에 머무는 것으로 본다.
     */
    public boolean isAttended(Instant now, Duration heartbeatInterval) {
        return attachedWatchers > 0 || now.isBefore(lastActivityAt.plus(heartbeatInterval));
    }

    public void redirectToPayment(Instant now) {
        requirePhase(CheckoutPhase.ACTIVE);
        this.phase = CheckoutPhase.REDIRECTED;
        this.paymentDeadline = now.plus(ttl).plus(grace);
    }

    /**
     * 결제 대기 시간이 지났으면 세션을 종료한다. 종료했으면 true.
     */
    public boolean abandonPaymentIfOverdue(Instant now) {
        if (phase != CheckoutPhase.REDIRECTED || now.isBefore(paymentDeadline)) {
            return false;
        }
        this.phase = CheckoutPhase.IDLE;
        return true;
    }

    /**
     * 결제사로 넘어가기 전이라면 세션을 종료한다. 종료했으면 true.
     */
    public boolean release() {
        if (phase == CheckoutPhase.IDLE || phase == CheckoutPhase.REDIRECTED) {
            return false;
        }
        this.phase = CheckoutPhase.IDLE;
        return true;
    }

    public void complete() {
        requirePhase(CheckoutPhase.REDIRECTED);
        this.phase = CheckoutPhase.IDLE;
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public void attachWatcher() {
        attachedWatchers++;
    }

    public void detachWatcher() {
        attachedWatchers = Math.max(0, attachedWatchers - 1);
    }

    public Duration remaining(Instant now) {
        return switch (phase) {
            case RESERVING -> ttl;
            case ACTIVE -> positive(Duration.between(now, deadline));
            case IDLE, WARNING, REDIRECTED -> Duration.ZERO;
        };
    }

    public Duration graceRemaining(Instant now) {
        if (phase != CheckoutPhase.WARNING) {
            return Duration.ZERO;
        }
        return positive(Duration.between(now, graceDeadline));
    }

    public CheckoutStatus statusAt(Instant now) {
        Set<String> shown = phase == CheckoutPhase.RESERVING ? productIds : reservedProductIds;
        return new CheckoutStatus(id, holderId, phase, shown, remaining(now), graceRemaining(now));
    }

    /**
     * 이 세션이 주어진 상품 중 하나라도 붙잡고 있는지. 선점 전에는 요청한 상품 전체를 기준으로 본다.
     * 세션 동기화 없이 호출할 수 있다.
     */
    public boolean holdsAny(Collection<String> products) {
        CheckoutPhase current = phase;
        if (current == CheckoutPhase.IDLE) {
            return false;
        }
        Set<String> held = current == CheckoutPhase.RESERVING ? productIds : reservedProductIds;
        return products.stream().anyMatch(held::contains);
    }

    public boolean isOwnedBy(String holderId) {
        return this.holderId.equals(holderId);
    }

    public boolean isInProgress() {
        return phase == CheckoutPhase.ACTIVE || phase == CheckoutPhase.WARNING;
    }

    public String getId() {
        return id;
    }

    public String getHolderId() {
        return holderId;
    }

    public Set<String> getProductIds() {
        return productIds;
    }

    public Set<String> getReservedProductIds() {
        return reservedProductIds;
    }

    public CheckoutPhase getPhase() {
        return phase;
    }

    private void requirePhase(CheckoutPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("체크아웃 상태가 " + expected + "가 아닙니다: " + phase);
        }
    }

    private static Duration positive(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }
}
