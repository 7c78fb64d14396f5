package kr.jemi.zcloset.common.web;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.scope.SubscriptionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * SSE 연결 하나와 그 연결에 묶인 구독들. 연결이 끝나면(완료, 타임아웃, 오류) 구독이 모두 해제된다.
 */
public class EventStream {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private final SseEmitter emitter;
    private final SubscriptionScope scope = new SubscriptionScope();

    private EventStream(long timeoutMillis) {
        this.emitter = new SseEmitter(timeoutMillis);
        emitter.onCompletion(scope::close);
        emitter.onTimeout(scope::close);
        emitter.onError(e -> scope.close());
    }

    public static EventStream open(long timeoutMillis) {
        return new EventStream(timeoutMillis);
    }

    public <T extends Subscription> T bind(T subscription) {
        return scope.add(subscription);
    }

    public void send(String name, Object data) {
        if (scope.isClosed()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("이벤트 스트림 전송 실패, 연결 종료: {}", e.getMessage());
            close();
        }
    }

    public void close() {
        scope.close();
        emitter.complete();
    }

    public SseEmitter emitter() {
        return emitter;
    }
}
