package kr.jemi.zcloset.presence.application.service;

import kr.jemi.zcloset.common.scope.RefreshableSubscription;
import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.InMemoryDocumentStore;
import kr.jemi.zcloset.presence.application.port.out.PresencePort;
import kr.jemi.zcloset.presence.domain.CartPresence;
import kr.jemi.zcloset.presence.infrastructure.out.store.PresenceStoreAdapter;
import kr.jemi.zcloset.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

class PresenceServiceTest {

    private MutableClock clock;
    private PresenceService presenceService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T09:00:00Z");
        presenceService = new PresenceService(new PresenceStoreAdapter(new InMemoryDocumentStore()), clock);
    }

    @Nested
    @DisplayName("장바구니 신호")
    class BagPresence {

        @Test
        @DisplayName("다른 구매자가 담은 상품만 원함 상태가 된다")
        void wantedByOthersExcludesSelf() {
            presenceService.setPresent("P1", "u1");
            presenceService.setPresent("P2", "u2");

            Set<String> wanted = presenceService.findWantedByOthers(List.of("P1", "P2", "P3"), "u1");

            assertThat(wanted).containsExactly("P2");
        }

        @Test
        @DisplayName("같은 구매자가 여러 번 담아도 신호는 하나다")
        void setIsIdempotent() {
            presenceService.setPresent("P1", "u2");
            presenceService.setPresent("P1", "u2");
            presenceService.clearPresent("P1", "u2");

            assertThat(presenceService.findWantedByOthers(List.of("P1"), "u1")).isEmpty();
        }

        @Test
        @DisplayName("구분자가 들어간 ID 조합도 서로의 신호를 덮어쓰지 않는다")
        void idsWithSeparatorDoNotCollide() {
            presenceService.setPresent("A", "B_C");
            presenceService.setPresent("A_B", "C");

            presenceService.clearPresent("A_B", "C");

            assertThat(presenceService.findWantedByOthers(List.of("A", "A_B"), "u1")).containsExactly("A");
        }

        @Test
        @DisplayName("일괄 해제와 복원은 해당 구매자의 신호만 바꾼다")
        void batchClearAndRestore() {
            presenceService.setPresent("P1", "u2");
            presenceService.setPresent("P1", "u3");
            presenceService.setPresent("P2", "u2");

            presenceService.clearPresentBatch(List.of("P1", "P2"), "u2");
            assertThat(presenceService.findWantedByOthers(List.of("P1", "P2"), "u1")).containsExactly("P1");

            presenceService.clearPresent("P1", "u3");
            presenceService.restorePresentBatch(List.of("P2"), "u2");
            assertThat(presenceService.findWantedByOthers(List.of("P1", "P2"), "u1")).containsExactly("P2");
        }

        @Test
        @DisplayName("빈 상품 ID나 구매자 ID는 무시한다")
        void blankIgnored() {
            assertThatCode(() -> {
                presenceService.setPresent(" ", "u1");
                presenceService.setPresent("P1", null);
                presenceService.clearPresent(null, "u1");
            }).doesNotThrowAnyException();

            assertThat(presenceService.findWantedByOthers(List.of("P1"), "u2")).isEmpty();
        }

        @Test
        @DisplayName("저장소 오류는 호출자에게 전파되지 않는다")
        void storeFailureSwallowed() {
            PresencePort port = mock(PresencePort.class);
            willThrow(new IllegalStateException("store down")).given(port).save(any());
            PresenceService service = new PresenceService(port, clock);

            assertThatCode(() -> service.setPresent("P1", "u1")).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("원함 상태 구독")
    class SubscribeWantedByOthers {

        @Test
        @DisplayName("구독 즉시 현재 상태를 받고 다른 구매자의 담기를 따라간다")
        void followsChanges() {
            List<Set<String>> received = new ArrayList<>();
            presenceService.setPresent("P1", "u2");

            RefreshableSubscription subscription = presenceService.subscribeWantedByOthers(
                    List.of("P1", "P2"), "u1", Set::of, received::add);
            presenceService.setPresent("P2", "u3");
            presenceService.clearPresent("P1", "u2");

            assertThat(received.get(0)).containsExactly("P1");
            assertThat(received.get(received.size() - 1)).containsExactly("P2");
            subscription.cancel();
        }

        @Test
        @DisplayName("잠긴 상품은 원함 집합에서 빠지고 refresh()로 다시 계산된다")
        void lockedSubtracted() {
            List<Set<String>> received = new ArrayList<>();
            Set<String> locked = new HashSet<>(Set.of("P1"));
            presenceService.setPresent("P1", "u2");

            RefreshableSubscription subscription = presenceService.subscribeWantedByOthers(
                    List.of("P1"), "u1", () -> Set.copyOf(locked), received::add);
            assertThat(received.get(received.size() - 1)).isEmpty();

            locked.clear();
            subscription.refresh();

            assertThat(received.get(received.size() - 1)).containsExactly("P1");
        }

        @Test
        @DisplayName("조회에 실패한 상품은 직전 값을 유지한다")
        void failureKeepsPrevious() {
            // given
            PresencePort port = mock(PresencePort.class);
            ArgumentCaptor<Runnable> onChange = ArgumentCaptor.forClass(Runnable.class);
            given(port.watchProduct(eq("P1"), onChange.capture())).willReturn(Subscription.NOOP);
            given(port.findByProduct("P1"))
                    .willReturn(List.of(new CartPresence("P1", "u2", clock.instant())))
                    .willThrow(new IllegalStateException("store down"));
            PresenceService service = new PresenceService(port, clock);
            List<Set<String>> received = new ArrayList<>();

            // when
            service.subscribeWantedByOthers(List.of("P1"), "u1", Set::of, received::add);
            onChange.getValue().run();

            // then
            assertThat(received).hasSize(2);
            assertThat(received.get(1)).containsExactly("P1");
        }

        @Test
        @DisplayName("해제한 구독은 refresh()에도 알림을 보내지 않는다")
        void cancelledIsSilent() {
            List<Set<String>> received = new ArrayList<>();
            RefreshableSubscription subscription = presenceService.subscribeWantedByOthers(
                    List.of("P1"), "u1", Set::of, received::add);

            subscription.cancel();
            presenceService.setPresent("P1", "u2");
            subscription.refresh();

            assertThat(received).hasSize(1);
        }
    }
}
