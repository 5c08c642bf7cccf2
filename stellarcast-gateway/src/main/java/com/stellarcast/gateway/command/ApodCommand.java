package com.stellarcast.gateway.command;

import java.util.Optional;

/**
 * Decoded schedule-management command.
 */
public sealed interface ApodCommand {

    /** Report whether daily delivery is on and when it fires next. */
    record Status() implements ApodCommand {
    }

    /** Turn daily delivery off. */
    record Stop() implements ApodCommand {
    }

    /** Turn daily delivery on, at {@code time} or the default send time. */
    record Start(Optional<String> time) implements ApodCommand {
        public Start {
            time = time == null ? Optional.empty() : time;
        }
    }
}
