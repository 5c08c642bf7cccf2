package com.stellarcast.gateway.delivery;

/**
 * Pipeline stages, in order. TRANSLATE and COMPOSE are alternatives.
 */
public enum DeliveryStage {
    RESOLVE_BOT,
    ENSURE_DATA,
    CLASSIFY_MEDIA,
    TRANSLATE,
    COMPOSE,
    SEND,
    ATTACH_METADATA,
    DONE
}
