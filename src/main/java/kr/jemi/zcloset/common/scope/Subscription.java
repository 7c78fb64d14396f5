package kr.jemi.zcloset.common.scope;

/**
 * 구독, 타이머 등 해제가 필요한 자원의 핸들. cancel()은 여러 번 호출해도 안전해야 한다.
 */
@FunctionalInterface
public interface Subscription {

    Subscription NOOP = () -> { };

    void cancel();
}
