package com.strata.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduleParser Tests")
class ScheduleParserTest {
    
    @Test
    @DisplayName("Should map daily and hourly schedules")
    void shouldMapKnownSchedules() {
        assertThat(ScheduleParser.interval("daily")).isEqualTo(Duration.ofHours(24));
        assertThat(ScheduleParser.interval("daily_at_02:00_utc")).isEqualTo(Duration.ofHours(24));
        assertThat(ScheduleParser.interval("Hourly")).isEqualTo(Duration.ofHours(1));
    }
    
    @Test
    @DisplayName("Should fall back to daily for anything else")
    void shouldFallBackToDaily() {
        assertThat(ScheduleParser.interval("weekly")).isEqualTo(Duration.ofHours(24));
        assertThat(ScheduleParser.interval(null)).isEqualTo(Duration.ofHours(24));
        assertThat(ScheduleParser.interval("  ")).isEqualTo(Duration.ofHours(24));
    }
}
