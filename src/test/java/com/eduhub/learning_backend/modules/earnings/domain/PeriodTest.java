package com.eduhub.learning_backend.modules.earnings.domain;

import com.eduhub.learning_backend.common.exception.BizException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodTest {

    @Test
    void parseShouldComputeUtcMonthBoundaries() {
        Period period = Period.parse("2025-02");

        assertThat(period.key()).isEqualTo("2025-02");
        assertThat(period.periodStart()).isEqualTo(LocalDateTime.of(2025, 2, 1, 0, 0, 0));
        assertThat(period.periodEnd()).isEqualTo(LocalDateTime.of(2025, 2, 28, 23, 59, 59));
        assertThat(period.nextPeriodStart()).isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0, 0));
    }

    @Test
    void leapYearFebruaryEndsOn29th() {
        assertThat(Period.parse("2024-02").periodEnd()).isEqualTo(LocalDateTime.of(2024, 2, 29, 23, 59, 59));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2025-3", "2025-13", "2025-00", "25-03", "2025/03", "march", "", "2025-03-01"})
    void malformedPeriodShouldBeRejectedWith400(String raw) {
        assertThatThrownBy(() -> Period.parse(raw))
                .isInstanceOf(BizException.class)
                .satisfies(e -> assertThat(((BizException) e).getCode()).isEqualTo(400));
    }

    @Test
    void nullPeriodShouldBeRejected() {
        assertThatThrownBy(() -> Period.parse(null)).isInstanceOf(BizException.class);
    }

    @Test
    void previousShouldUseUtcEvenWhenClockZoneDiffers() {
        // 2025-04-01 00:30 UTC 在上海已是 08:30，但账期仍按 UTC 计算
        Clock clock = Clock.fixed(Instant.parse("2025-04-01T00:30:00Z"), ZoneId.of("Asia/Shanghai"));

        assertThat(Period.current(clock).key()).isEqualTo("2025-04");
        assertThat(Period.previous(clock).key()).isEqualTo("2025-03");
    }

    @Test
    void previousOfJanuaryIsDecemberOfPriorYear() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T02:00:00Z"), ZoneOffset.UTC);

        assertThat(Period.previous(clock)).isEqualTo(Period.parse("2024-12"));
    }
}
