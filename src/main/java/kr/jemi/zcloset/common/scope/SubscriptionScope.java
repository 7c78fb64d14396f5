package kr.jemi.zcloset.common.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 여러 구독과 타이머를 한 번에 해제하기 위한 스코프.
 * close() 이후에 추가된 구독은 즉시 해제된다.
 */
public class SubscriptionScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionScope.class);

    private final List<Subscription> subscriptions = new ArrayList<>();
    private boolean closed;

    public <T extends Subscription> T add(T subscription) {
        boolean cancelNow;
        synchronized (this) {
            cancelNow = closed;
            if (!closed) {
                subscriptions.add(subscription);
            }
        }
        if (cancelNow) {
            subscription.cancel();
        }
        return subscription;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        List<Subscription> toCancel;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toCancel = List.copyOf(subscriptions);
            subscriptions.clear();
        }
        for (Subscription subscription : toCancel) {
            try {
                subscription.cancel();
            } catch (RuntimeException e) {
                log.warn("구독 해제 실패", e);
            }
        }
    }
}
