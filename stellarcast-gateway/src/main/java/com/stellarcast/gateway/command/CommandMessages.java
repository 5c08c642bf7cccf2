package com.stellarcast.gateway.command;

/**
 * Replies to schedule-management commands.
 */
final class CommandMessages {

    private CommandMessages() {
    }

    static final String NOT_CONFIGURED = "The astronomy picture feature is not configured (missing APOD API key).";
    static final String NOT_RUNNING = "Daily astronomy picture delivery is not running.";
    static final String RUNNING = "Daily astronomy picture delivery is running | next send: %s";
    static final String UNKNOWN = "unknown";
    static final String STOPPED = "Daily astronomy picture delivery stopped.";
    static final String STARTED_DEFAULT = "Daily astronomy picture delivery started, default send time %s.";
    static final String STARTED = "Daily astronomy picture delivery started, send time %s.";
    static final String INVALID_TIME = "Invalid time: use HH:MM.";
    static final String START_FAILED = "Failed to set up daily astronomy picture delivery.";
    static final String STOP_FAILED = "Failed to stop daily astronomy picture delivery.";
}
