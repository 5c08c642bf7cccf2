package com.stellarcast.media.apod;

/**
 * Thrown for a date argument that is not {@code YYYY-MM-DD} or predates the
 * first APOD entry.
 */
public class InvalidDateFormatException extends IllegalArgumentException {

    public InvalidDateFormatException(String message) {
        super(message);
    }
}
