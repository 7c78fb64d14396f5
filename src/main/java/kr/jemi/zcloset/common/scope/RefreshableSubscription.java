package kr.jemi.zcloset.common.scope;

/**
 * 외부 입력이 바뀌었을 때 구독자가 직접 재계산을 요청할 수 있는 구독.
 */
public interface RefreshableSubscription extends Subscription {

    RefreshableSubscription NOOP = new RefreshableSubscription() {
        @Override
        public void refresh() {
        }

        @Override
        public void cancel() {
        }
    };

    void refresh();
}
