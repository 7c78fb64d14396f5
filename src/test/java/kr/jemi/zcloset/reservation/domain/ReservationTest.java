package kr.jemi.zcloset.reservation.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReservationTest {

    private static final Instant NOW = Instant.parse("2026-01-01T09:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(10);

    @Test
    @DisplayName("선점은 발급 시각부터 TTL 동안 유효하다")
    void issueSetsExpiry() {
        Reservation reservation = Reservation.issue("P1", "u1", NOW, TTL);

        assertThat(reservation.expiresAt()).isEqualTo(NOW.plus(TTL));
        assertThat(reservation.isLiveAt(NOW.plus(TTL).minusMillis(1))).isTrue();
        assertThat(reservation.isLiveAt(NOW.plus(TTL))).isFalse();
    }

    @Test
    @DisplayName("연장하면 만료 시각이 현재 시각 + TTL로 다시 설정된다")
    void renewResetsExpiry() {
        Reservation reservation = Reservation.issue("P1", "u1", NOW, TTL);

        Reservation renewed = reservation.renew(NOW.plusSeconds(120), TTL);

        assertThat(renewed.expiresAt()).isEqualTo(NOW.plusSeconds(120).plus(TTL));
        assertThat(renewed.holderId()).isEqualTo("u1");
    }

    @Test
    @DisplayName("보유자 본인에게는 잠금으로 보이지 않는다")
    void holderIsNotBlocked() {
        Reservation reservation = Reservation.issue("P1", "u1", NOW, TTL);

        assertThat(reservation.blocks("u1", NOW)).isFalse();
        assertThat(reservation.blocks("u2", NOW)).isTrue();
        assertThat(reservation.blocks(null, NOW)).isTrue();
    }

    @Test
    @DisplayName("만료된 선점은 누구나 다시 선점할 수 있다")
    void expiredIsClaimable() {
        Reservation reservation = Reservation.issue("P1", "u1", NOW, TTL);

        assertThat(reservation.isClaimableBy("u2", NOW)).isFalse();
        assertThat(reservation.isClaimableBy("u1", NOW)).isTrue();
        assertThat(reservation.isClaimableBy("u2", NOW.plus(TTL))).isTrue();
        assertThat(reservation.blocks("u2", NOW.plus(TTL))).isFalse();
    }

    @Test
    @DisplayName("보유자 없이 만들 수 없다")
    void holderRequired() {
        assertThatThrownBy(() -> Reservation.issue("P1", " ", NOW, TTL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("holderId");
    }
}
