package com.stellarcast.channel;

/**
 * Thrown when a persisted destination cannot be decoded.
 */
public class DestinationDecodeException extends RuntimeException {

    public DestinationDecodeException(String message) {
        super(message);
    }

    public DestinationDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
