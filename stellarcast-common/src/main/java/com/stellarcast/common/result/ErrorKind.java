package com.stellarcast.common.result;

/**
 * Failure categories reported by collaborators and the delivery pipeline.
 */
public enum ErrorKind {
    INVALID_TIME_FORMAT,
    INVALID_DATE_FORMAT,
    DECODE_ERROR,
    FETCH_FAILURE,
    /** Not an error as such: the picture of the day is a video. */
    MEDIA_TYPE_MISMATCH,
    TRANSLATE_FAILURE,
    COMPOSE_FAILURE,
    SEND_FAILURE,
    STORE_CORRUPT
}
