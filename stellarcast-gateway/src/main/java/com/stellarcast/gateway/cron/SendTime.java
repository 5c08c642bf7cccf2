package com.stellarcast.gateway.cron;

import java.util.regex.Pattern;

/**
 * Daily time of day for a scheduled delivery, in the host timezone.
 */
public record SendTime(int hour, int minute) {

    private static final Pattern FORMAT = Pattern.compile("^\\d{1,2}:\\d{2}$");

    public SendTime {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new InvalidTimeFormatException("time out of range: " + hour + ":" + minute);
        }
    }

    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidTimeFormatException e) {
            return false;
        }
    }

    /**
     * Parse {@code H:MM} or {@code HH:MM}.
     *
     * @throws InvalidTimeFormatException if malformed or out of range
     */
    public static SendTime parse(String raw) {
        if (raw == null || !FORMAT.matcher(raw).matches()) {
            throw new InvalidTimeFormatException("expected HH:MM, got: " + raw);
        }
        int colon = raw.indexOf(':');
        return new SendTime(Integer.parseInt(raw.substring(0, colon)), Integer.parseInt(raw.substring(colon + 1)));
    }

    /** Zero-padded {@code HH:MM}. */
    public String format() {
        return String.format("%02d:%02d", hour, minute);
    }

    /** Spring cron expression firing daily at this time. */
    String cronExpression() {
        return "0 " + minute + " " + hour + " * * *";
    }

    @Override
    public String toString() {
        return format();
    }
}
