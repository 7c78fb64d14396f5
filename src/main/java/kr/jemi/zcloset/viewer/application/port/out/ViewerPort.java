package kr.jemi.zcloset.viewer.application.port.out;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.viewer.domain.Viewer;

import java.util.function.IntConsumer;

public interface ViewerPort {

    void save(Viewer viewer);

    void delete(String productId, String viewerId);

    int countByProduct(String productId);

    Subscription watchCount(String productId, IntConsumer onChange);
}
