package kr.jemi.zcloset.viewer.application.port.in;

import kr.jemi.zcloset.common.scope.Subscription;

import java.util.function.IntConsumer;

public interface CountViewersUseCase {

    int countViewers(String productId);

    Subscription subscribeCount(String productId, IntConsumer callback);
}
