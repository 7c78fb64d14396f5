package kr.jemi.zcloset.checkout.application.service;

import kr.jemi.zcloset.common.scope.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * 체크아웃 세션마다 카운트다운 tick을 주기적으로 실행한다. 반환된 구독을 해제하면 타이머가 멈춘다.
 */
@Component
public class CheckoutTimer {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTimer.class);

    private final TaskScheduler taskScheduler;
    private final Duration tickInterval;

    public CheckoutTimer(TaskScheduler taskScheduler,
                         @Value("${zcloset.checkout.tick-interval-ms}") long tickIntervalMillis) {
        this.taskScheduler = taskScheduler;
        this.tickInterval = Duration.ofMillis(tickIntervalMillis);
    }

    public Subscription start(String checkoutId, Runnable tick) {
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (Exception e) {
                log.error("체크아웃 타이머 실행 실패: checkoutId={}", checkoutId, e);
            }
        }, tickInterval);
        return () -> future.cancel(false);
    }
}
