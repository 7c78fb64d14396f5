package kr.jemi.zcloset.presence.application.service;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;
import kr.jemi.zcloset.presence.api.PresenceFacade;
import kr.jemi.zcloset.presence.application.port.in.UpdateBagPresenceUseCase;
import kr.jemi.zcloset.presence.application.port.in.WatchWantedUseCase;
import kr.jemi.zcloset.presence.application.port.out.PresencePort;
import kr.jemi.zcloset.presence.domain.CartPresence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static kr.jemi.zcloset.common.validation.ValidationUtils.distinctIds;
import static kr.jemi.zcloset.common.validation.ValidationUtils.isBlank;

@Service
public class PresenceService implements UpdateBagPresenceUseCase, WatchWantedUseCase, PresenceFacade {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final PresencePort presencePort;
    private final Clock clock;

    public PresenceService(PresencePort presencePort, Clock clock) {
        this.presencePort = presencePort;
        this.clock = clock;
    }

    @Override
    public void setPresent(String productId, String holderId) {
        if (isBlank(productId) || isBlank(holderId)) {
            return;
        }
        try {
            presencePort.save(new CartPresence(productId, holderId, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("장바구니 신호 저장 실패: productId={}", productId, e);
        }
    }

    @Override
    public void clearPresent(String productId, String holderId) {
        if (isBlank(productId) || isBlank(holderId)) {
            return;
        }
        try {
            presencePort.delete(productId, holderId);
        } catch (RuntimeException e) {
            log.warn("장바구니 신호 삭제 실패: productId={}", productId, e);
        }
    }

    @Override
    public void clearPresentBatch(Collection<String> productIds, String holderId) {
        distinctIds(productIds).forEach(productId -> clearPresent(productId, holderId));
    }

    @Override
    public void restorePresentBatch(Collection<String> productIds, String holderId) {
        distinctIds(productIds).forEach(productId -> setPresent(productId, holderId));
    }

    @Override
    public Set<String> findWantedByOthers(Collection<String> productIds, String viewerHolderId) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String productId : distinctIds(productIds)) {
            try {
                boolean wantedByOthers = presencePort.findByProduct(productId).stream()
                        .anyMatch(presence -> !presence.isHeldBy(viewerHolderId));
                if (wantedByOthers) {
                    wanted.add(productId);
                }
            } catch (RuntimeException e) {
                log.warn("장바구니 조회 실패: productId={}", productId, e);
            }
        }
        return Set.copyOf(wanted);
    }

    @Override
    public RefreshableSubscription subscribeWantedByOthers(Collection<String> productIds, String viewerHolderId,
                                                           Supplier<Set<String>> lockedSet,
                                                           Consumer<Set<String>> callback) {
        Set<String> ids = distinctIds(productIds);
        if (ids.isEmpty()) {
            callback.accept(Set.of());
            return RefreshableSubscription.NOOP;
        }
        WantedByOthersWatch watch = new WantedByOthersWatch(ids, viewerHolderId, lockedSet, callback, presencePort);
        watch.open();
        return watch;
    }
}
