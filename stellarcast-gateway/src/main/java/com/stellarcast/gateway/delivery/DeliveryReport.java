package com.stellarcast.gateway.delivery;

/**
 * Result of one pipeline run.
 *
 * @param result  how it ended
 * @param stage   the stage that ended it
 * @param notice  user-facing text for the destination, or null
 */
public record DeliveryReport(DeliveryResult result, DeliveryStage stage, String notice) {

    public static DeliveryReport done() {
        return new DeliveryReport(DeliveryResult.DONE, DeliveryStage.DONE, null);
    }

    public static DeliveryReport failed(DeliveryResult result, DeliveryStage stage, String notice) {
        return new DeliveryReport(result, stage, notice);
    }

    public boolean isDone() {
        return result == DeliveryResult.DONE;
    }
}
