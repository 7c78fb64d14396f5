package kr.jemi.zcloset.checkout.infrastructure.out.memory;

import kr.jemi.zcloset.checkout.application.port.out.CheckoutSessionPort;
import kr.jemi.zcloset.checkout.domain.CheckoutSession;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 체크아웃 세션은 타이머가 도는 인스턴스에만 존재한다. 선점 자체는 문서 저장소에 있으므로 세션을 잃어도 TTL로 정리된다.
 */
@Component
public class CheckoutSessionMemoryAdapter implements CheckoutSessionPort {

    private final Map<String, CheckoutSession> sessions = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean register(CheckoutSession session) {
        boolean overlapping = sessions.values().stream()
                .anyMatch(other -> other.isOwnedBy(session.getHolderId())
                        && other.holdsAny(session.getProductIds()));
        if (overlapping) {
            return false;
        }
        sessions.put(session.getId(), session);
        return true;
    }

    @Override
    public void save(CheckoutSession session) {
        sessions.put(session.getId(), session);
    }

    @Override
    public Optional<CheckoutSession> findById(String checkoutId) {
        return Optional.ofNullable(sessions.get(checkoutId));
    }

    @Override
    public void delete(String checkoutId) {
        sessions.remove(checkoutId);
    }
}
