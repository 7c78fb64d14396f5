package kr.jemi.zcloset.reservation.application.service;

import kr.jemi.zcloset.common.scope.Subscription;
import kr.jemi.zcloset.common.store.InMemoryDocumentStore;
import kr.jemi.zcloset.reservation.application.port.out.ReservationPort;
import kr.jemi.zcloset.reservation.domain.Reservation;
import kr.jemi.zcloset.reservation.domain.ReserveOutcome;
import kr.jemi.zcloset.reservation.infrastructure.out.store.ReservationStoreAdapter;
import kr.jemi.zcloset.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

class ReservationServiceTest {

    private static final long TTL_SECONDS = 600;

    private MutableClock clock;
    private InMemoryDocumentStore store;
    private ReservationService reservationService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T09:00:00Z");
        store = new InMemoryDocumentStore();
        reservationService = new ReservationService(new ReservationStoreAdapter(store), clock, TTL_SECONDS, 120);
    }

    @Nested
    @DisplayName("선점")
    class Reserve {

        @Test
        @DisplayName("다른 구매자가 잠근 상품은 conflicted로 분류된다")
        void mutualExclusion() {
            // given
            reservationService.reserve(List.of("P1"), "u1");

            // when
            ReserveOutcome outcome = reservationService.reserve(List.of("P1", "P2"), "u2");

            // then
            assertThat(outcome.reserved()).containsExactly("P2");
            assertThat(outcome.conflicted()).containsExactly("P1");
            assertThat(outcome.failed()).isEmpty();
        }

        @Test
        @DisplayName("본인이 이미 보유한 상품은 다시 선점할 수 있다")
        void reReserveByHolder() {
            reservationService.reserve(List.of("P1"), "u1");
            clock.advance(Duration.ofMinutes(5));

            ReserveOutcome outcome = reservationService.reserve(List.of("P1"), "u1");

            assertThat(outcome.reserved()).containsExactly("P1");
        }

        @Test
        @DisplayName("만료된 선점은 다른 구매자가 가져간다")
        void expiredReclaim() {
            reservationService.reserve(List.of("P1"), "u1");
            clock.advance(Duration.ofSeconds(TTL_SECONDS));

            ReserveOutcome outcome = reservationService.reserve(List.of("P1"), "u2");

            assertThat(outcome.reserved()).containsExactly("P1");
            assertThat(reservationService.findReservedByOthers(List.of("P1"), "u1")).containsExactly("P1");
        }

        @Test
        @DisplayName("중복과 공백 ID는 한 번만 처리된다")
        void duplicatesCollapsed() {
            ReserveOutcome outcome = reservationService.reserve(List.of("P1", "P1", " "), "u1");

            assertThat(outcome.reserved()).containsExactly("P1");
        }

        @Test
        @DisplayName("보유자 없이 선점하면 아무 것도 하지 않는다")
        void blankHolder() {
            ReserveOutcome outcome = reservationService.reserve(List.of("P1"), "");

            assertThat(outcome.reserved()).isEmpty();
            assertThat(reservationService.findReservedByOthers(List.of("P1"), "u2")).isEmpty();
        }

        @Test
        @DisplayName("저장소 오류가 난 상품만 failed로 분류된다")
        void storeFailureIsolated() {
            ReservationPort port = mock(ReservationPort.class);
            given(port.createIfClaimable(any(), any())).willReturn(true);
            given(port.createIfClaimable(eq(Reservation.issue("P2", "u1", clock.instant(), Duration.ofSeconds(TTL_SECONDS))), any()))
                    .willThrow(new IllegalStateException("store down"));
            ReservationService service = new ReservationService(port, clock, TTL_SECONDS, 120);

            ReserveOutcome outcome = service.reserve(List.of("P1", "P2"), "u1");

            assertThat(outcome.reserved()).containsExactly("P1");
            assertThat(outcome.failed()).containsExactly("P2");
        }
    }

    @Nested
    @DisplayName("연장과 해제")
    class ExtendAndRelease {

        @Test
        @DisplayName("연장은 본인이 보유한 상품만 대상으로 한다")
        void extendOnlyOwn() {
            reservationService.reserve(List.of("P1"), "u1");
            reservationService.reserve(List.of("P2"), "u2");
            clock.advance(Duration.ofMinutes(9));

            Set<String> extended = reservationService.extend(List.of("P1", "P2", "P3"), "u1");

            assertThat(extended).containsExactly("P1");
            clock.advance(Duration.ofMinutes(9));
            assertThat(reservationService.findReservedByOthers(List.of("P1", "P2"), "u3")).containsExactly("P1");
        }

        @Test
        @DisplayName("만료 후 다른 구매자가 가져간 상품은 연장되지 않는다")
        void extendAfterLoss() {
            reservationService.reserve(List.of("P1"), "u1");
            clock.advance(Duration.ofSeconds(TTL_SECONDS));
            reservationService.reserve(List.of("P1"), "u2");

            assertThat(reservationService.extend(List.of("P1"), "u1")).isEmpty();
        }

        @Test
        @DisplayName("다른 구매자의 선점은 해제할 수 없다")
        void releaseGuardsOwnership() {
            reservationService.reserve(List.of("P1"), "u1");

            reservationService.release(List.of("P1"), "u2");

            assertThat(reservationService.findReservedByOthers(List.of("P1"), "u2")).containsExactly("P1");
        }

        @Test
        @DisplayName("해제는 여러 번 호출해도 안전하다")
        void releaseIdempotent() {
            reservationService.reserve(List.of("P1"), "u1");

            reservationService.release(List.of("P1"), "u1");
            reservationService.release(List.of("P1"), "u1");

            assertThat(reservationService.findReservedByOthers(List.of("P1"), "u2")).isEmpty();
        }
    }

    @Nested
    @DisplayName("다른 구매자의 선점 구독")
    class SubscribeReservedByOthers {

        @Test
        @DisplayName("구독 즉시 현재 상태를 받고 이후 선점과 해제를 따라간다")
        void followsChanges() {
            List<Set<String>> received = new ArrayList<>();
            reservationService.reserve(List.of("P1"), "u2");

            Subscription subscription = reservationService.subscribeReservedByOthers(
                    List.of("P1", "P2"), "u1", received::add);
            reservationService.reserve(List.of("P2"), "u3");
            reservationService.release(List.of("P1"), "u2");

            assertThat(received.get(0)).containsExactly("P1");
            assertThat(received.get(received.size() - 1)).containsExactly("P2");
            subscription.cancel();
        }

        @Test
        @DisplayName("본인 선점은 잠금으로 보이지 않는다")
        void ownReservationInvisible() {
            List<Set<String>> received = new ArrayList<>();
            reservationService.subscribeReservedByOthers(List.of("P1"), "u1", received::add);

            reservationService.reserve(List.of("P1"), "u1");

            assertThat(received).allSatisfy(set -> assertThat(set).isEmpty());
        }

        @Test
        @DisplayName("해제한 구독은 더 이상 알림을 받지 않는다")
        void cancelStopsNotifications() {
            List<Set<String>> received = new ArrayList<>();
            Subscription subscription = reservationService.subscribeReservedByOthers(
                    List.of("P1"), "u1", received::add);

            subscription.cancel();
            reservationService.reserve(List.of("P1"), "u2");

            assertThat(received).hasSize(1);
        }

        @Test
        @DisplayName("빈 목록 구독은 빈 집합을 한 번 전달한다")
        void emptyIds() {
            List<Set<String>> received = new ArrayList<>();

            Subscription subscription = reservationService.subscribeReservedByOthers(List.of(), "u1", received::add);

            assertThat(received).containsExactly(Set.of());
            assertThat(subscription).isSameAs(Subscription.NOOP);
        }
    }
}
