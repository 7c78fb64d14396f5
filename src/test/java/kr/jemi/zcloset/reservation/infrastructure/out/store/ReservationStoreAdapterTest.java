package kr.jemi.zcloset.reservation.infrastructure.out.store;

import kr.jemi.zcloset.common.store.Document;
import kr.jemi.zcloset.common.store.InMemoryDocumentStore;
import kr.jemi.zcloset.reservation.domain.Reservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReservationStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(10);

    private InMemoryDocumentStore store;
    private ReservationStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        adapter = new ReservationStoreAdapter(store);
    }

    @Test
    @DisplayName("상품 ID를 문서 키로, 시각을 epoch millis로 저장한다")
    void storesDocumentLayout() {
        // when
        adapter.createIfClaimable(Reservation.issue("P1", "u1", NOW, TTL), NOW);

        // then
        Document document = store.get(ReservationStoreAdapter.COLLECTION, "P1").orElseThrow();
        assertThat(document.require("holderId")).isEqualTo("u1");
        assertThat(document.require("expiresAt")).isEqualTo(Long.toString(NOW.plus(TTL).toEpochMilli()));
        assertThat(adapter.find("P1")).contains(Reservation.issue("P1", "u1", NOW, TTL));
    }

    @Test
    @DisplayName("살아 있는 다른 구매자의 선점은 덮어쓰지 않는다")
    void createRejectsLiveForeign() {
        adapter.createIfClaimable(Reservation.issue("P1", "u1", NOW, TTL), NOW);

        boolean created = adapter.createIfClaimable(Reservation.issue("P1", "u2", NOW, TTL), NOW);

        assertThat(created).isFalse();
        assertThat(adapter.find("P1")).get().extracting(Reservation::holderId).isEqualTo("u1");
    }

    @Test
    @DisplayName("연장은 보유자가 바뀌었으면 쓰지 않는다")
    void renewGuardsHolder() {
        adapter.createIfClaimable(Reservation.issue("P1", "u2", NOW, TTL), NOW);

        boolean renewed = adapter.renewIfHeldBy(Reservation.issue("P1", "u1", NOW.plusSeconds(60), TTL));

        assertThat(renewed).isFalse();
    }

    @Test
    @DisplayName("없는 선점은 연장해도 만들어지지 않는다")
    void renewDoesNotCreate() {
        boolean renewed = adapter.renewIfHeldBy(Reservation.issue("P1", "u1", NOW, TTL));

        assertThat(renewed).isFalse();
        assertThat(adapter.find("P1")).isEmpty();
    }

    @Test
    @DisplayName("보유자만 선점 문서를 지울 수 있다")
    void deleteGuardsHolder() {
        adapter.createIfClaimable(Reservation.issue("P1", "u1", NOW, TTL), NOW);

        assertThat(adapter.deleteIfHeldBy("P1", "u2")).isFalse();
        assertThat(adapter.deleteIfHeldBy("P1", "u1")).isTrue();
        assertThat(adapter.find("P1")).isEmpty();
    }
}
