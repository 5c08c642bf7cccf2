package com.stellarcast.gateway.command;

/**
 * Decoded one-shot picture request.
 */
public sealed interface PictureCommand {

    record Today() implements PictureCommand {
    }

    record Random() implements PictureCommand {
    }

    /** {@code date} is the raw {@code YYYY-MM-DD} argument, validated on use. */
    record ByDate(String date) implements PictureCommand {
    }
}
