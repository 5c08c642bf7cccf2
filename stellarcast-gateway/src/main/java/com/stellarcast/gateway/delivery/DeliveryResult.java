package com.stellarcast.gateway.delivery;

/**
 * How a delivery ended.
 */
public enum DeliveryResult {
    DONE,
    BOT_OFFLINE,
    FETCH_FAILED,
    NOT_AN_IMAGE,
    COMPOSE_FAILED,
    SEND_FAILED,
    INVALID_DATE
}
