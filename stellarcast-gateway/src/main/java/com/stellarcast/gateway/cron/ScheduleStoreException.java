package com.stellarcast.gateway.cron;

/**
 * The schedule file could not be written.
 */
public class ScheduleStoreException extends RuntimeException {

    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
