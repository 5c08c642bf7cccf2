package com.stellarcast.gateway.delivery;

import com.stellarcast.common.config.StellarcastConfig;

import java.time.Duration;

/**
 * Pipeline switches, read once from configuration.
 *
 * @param puzzleMode                    send a composed card instead of picture + text
 * @param hdImage                       prefer {@code hdurl} for the "original" attachment
 * @param notifyOnScheduledFetchFailure tell a scheduled destination when the fetch failed
 * @param consumeComposedOnCommand      drop the composed image after a "today" command used it
 * @param replyTtl                      lifetime of reply attachments
 * @param sendTimeout                   how long to wait for the platform to accept a message
 */
public record DeliverySettings(
        boolean puzzleMode,
        boolean hdImage,
        boolean notifyOnScheduledFetchFailure,
        boolean consumeComposedOnCommand,
        Duration replyTtl,
        Duration sendTimeout) {

    public static DeliverySettings from(StellarcastConfig config) {
        StellarcastConfig.ApodConfig apod = config.getApod();
        StellarcastConfig.DeliveryConfig delivery = config.getDelivery();
        return new DeliverySettings(
                Boolean.TRUE.equals(apod.getInfopuzzle()),
                Boolean.TRUE.equals(apod.getHdImage()),
                Boolean.TRUE.equals(delivery.getNotifyOnScheduledFetchFailure()),
                Boolean.TRUE.equals(delivery.getConsumeComposedOnCommand()),
                Duration.ofSeconds(delivery.getReplyMetadataTtlSeconds()),
                Duration.ofSeconds(delivery.getSendTimeoutSeconds()));
    }
}
