package com.example.support.service;

import com.example.support.config.SupportProperties;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StaffHours {

    private final SupportProperties supportProperties;
    private final Clock clock;

    /**
     * Whether the current hour in the team's time zone falls within staffed hours, both ends included.
     */
    public boolean isStaffedNow() {
        SupportProperties.Staff staff = supportProperties.getStaff();
        int hour = ZonedDateTime.now(clock.withZone(ZoneId.of(staff.getTimeZone()))).getHour();
        return hour >= staff.getWorkdayStartHour() && hour <= staff.getWorkdayEndHour();
    }
}
