package com.example.support.service;

import com.example.support.config.SupportProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class StaffHoursTest {

    // Asia/Yakutsk is UTC+9, staffed from 08:00 through 23:59.
    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "2024-04-30T22:59:00Z, false",
        "2024-04-30T23:00:00Z, true",
        "2024-05-01T06:00:00Z, true",
        "2024-05-01T14:59:00Z, true",
        "2024-05-01T15:00:00Z, false"
    })
    void shouldFollowTeamTimeZone(String instant, boolean staffed) {
        StaffHours hours = new StaffHours(new SupportProperties(), Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));

        assertThat(hours.isStaffedNow()).isEqualTo(staffed);
    }
}
