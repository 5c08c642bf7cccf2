package com.stellarcast.gateway.delivery;

/**
 * User-facing texts sent by the delivery pipeline.
 */
public final class DeliveryMessages {

    private DeliveryMessages() {
    }

    public static final String TODAY_CAPTION = "Today's astronomy picture";
    public static final String RANDOM_CAPTION = "Random astronomy picture";
    public static final String BY_DATE_CAPTION = "Astronomy picture of ";

    public static final String FETCH_TODAY_FAILED = "Could not fetch today's astronomy picture, please try again later.";
    public static final String FETCH_RANDOM_FAILED = "Could not fetch a random astronomy picture, please try again later.";
    public static final String FETCH_BY_DATE_FAILED = "Could not fetch the astronomy picture for that date, please try again later.";

    public static final String VIDEO_TODAY = "Today NASA published an astronomy video, not a picture.";
    public static final String VIDEO_RANDOM = "The random pick is an astronomy video.";
    public static final String VIDEO_BY_DATE = "The astronomy entry for that date is a video.";

    public static final String INVALID_DATE = "Invalid date: use YYYY-MM-DD, after 1995-06-16.";
    public static final String COMPOSE_FAILED = "Failed to render today's astronomy picture.";
    public static final String SEND_FAILED = "Failed to send the astronomy picture.";

    /** Reply keyword that retrieves the translated explanation. */
    public static final String KEYWORD_EXPLAIN = "explain";
    /** Reply keyword that retrieves the original picture. */
    public static final String KEYWORD_ORIGINAL = "original";
}
