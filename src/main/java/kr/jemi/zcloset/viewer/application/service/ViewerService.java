package kr.jemi.zcloset.viewer.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.viewer.application.port.in.CountViewersUseCase;
import kr.jemi.zcloset.viewer.application.port.in.IssueViewerTokenUseCase;
import kr.jemi.zcloset.viewer.application.port.in.TrackViewerUseCase;
import kr.jemi.zcloset.viewer.application.port.out.ViewerPort;
import kr.jemi.zcloset.viewer.domain.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.IntConsumer;

import static kr.jemi.zcloset.common.validation.ValidationUtils.isBlank;

@Service
public class ViewerService implements TrackViewerUseCase, CountViewersUseCase, IssueViewerTokenUseCase {

    private static final Logger log = LoggerFactory.getLogger(ViewerService.class);

    private final ViewerPort viewerPort;
    private final Clock clock;
    private final TSID.Factory tsidFactory;

    public ViewerService(ViewerPort viewerPort, Clock clock, TSID.Factory tsidFactory) {
        this.viewerPort = viewerPort;
        this.clock = clock;
        this.tsidFactory = tsidFactory;
    }

    @Override
    public void addViewer(String productId, String viewerId) {
        if (isBlank(productId) || isBlank(viewerId)) {
            return;
        }
        try {
            viewerPort.save(new Viewer(productId, viewerId, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("조회자 등록 실패: productId={}", productId, e);
        }
    }

    @Override
    public void removeViewer(String productId, String viewerId) {
        if (isBlank(productId) || isBlank(viewerId)) {
            return;
        }
        try {
            viewerPort.delete(productId, viewerId);
        } catch (RuntimeException e) {
            log.warn("조회자 삭제 실패: productId={}", productId, e);
        }
    }

    @Override
    public int countViewers(String productId) {
        if (isBlank(productId)) {
            return 0;
        }
        return viewerPort.countByProduct(productId);
    }

    @Override
    public Subscription subscribeCount(String productId, IntConsumer callback) {
        if (isBlank(productId)) {
            callback.accept(0);
            return Subscription.NOOP;
        }
        return viewerPort.watchCount(productId, callback);
    }

    @Override
    public String issueViewerToken() {
        return tsidFactory.generate().encode(62);
    }
}
