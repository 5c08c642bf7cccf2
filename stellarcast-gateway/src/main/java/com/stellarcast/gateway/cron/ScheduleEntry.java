package com.stellarcast.gateway.cron;

import com.stellarcast.channel.Destination;

/**
 * One persisted subscription. {@code sendTime} is kept as stored; it is
 * validated when the entry is registered with the scheduler.
 */
public record ScheduleEntry(Destination destination, String sendTime) {
}
