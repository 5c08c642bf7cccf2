package com.stellarcast.gateway.cron;

/**
 * A send time that is not {@code HH:MM} within a day.
 */
public class InvalidTimeFormatException extends IllegalArgumentException {

    public InvalidTimeFormatException(String message) {
        super(message);
    }
}
