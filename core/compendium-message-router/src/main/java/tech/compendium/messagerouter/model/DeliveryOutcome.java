package tech.compendium.messagerouter.model;

import java.util.Optional;

/**
 * Result of handing a work message to its handler.
 */
public record DeliveryOutcome(DeliveryResult result, Optional<String> error) {

    public static DeliveryOutcome success() {
        return new DeliveryOutcome(DeliveryResult.SUCCESS, Optional.empty());
    }

    public static DeliveryOutcome failed(String error) {
        return new DeliveryOutcome(DeliveryResult.FAILED, Optional.ofNullable(error));
    }

    public static DeliveryOutcome rejected(String error) {
        return new DeliveryOutcome(DeliveryResult.REJECTED, Optional.ofNullable(error));
    }

    public String errorOrDefault() {
        return error.orElse("Unknown error");
    }
}
