package kr.jemi.zcloset.availability.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityTest {

    @Test
    @DisplayName("잠긴 상품은 원함 집합에서 제외된다")
    void lockedWinsOverWanted() {
        Availability availability = Availability.of(Set.of("P1"), Set.of("P1", "P2"));

        assertThat(availability.wantedByOthers()).containsExactly("P2");
        assertThat(availability.statusOf("P1")).isEqualTo(AvailabilityStatus.LOCKED);
        assertThat(availability.statusOf("P2")).isEqualTo(AvailabilityStatus.WANTED);
        assertThat(availability.statusOf("P3")).isEqualTo(AvailabilityStatus.FREE);
    }

    @Test
    @DisplayName("겹치는 집합으로 직접 만들 수 없다")
    void overlapRejected() {
        assertThatThrownBy(() -> new Availability(Set.of("P1"), Set.of("P1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("P1");
    }
}
