package com.stellarcast.gateway.cron;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Whether a destination has a live schedule, and when it fires next.
 */
public record ScheduleStatus(boolean running, Optional<ZonedDateTime> nextFire) {

    public static ScheduleStatus notRunning() {
        return new ScheduleStatus(false, Optional.empty());
    }
}
