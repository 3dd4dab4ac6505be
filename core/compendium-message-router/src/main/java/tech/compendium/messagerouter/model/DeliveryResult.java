package tech.compendium.messagerouter.model;

/**
 * What a handler made of a delivery.
 */
public enum DeliveryResult {
    /** Processed; acknowledge */
    SUCCESS,

    /** Transient failure; retry until the attempt limit, then dead-letter */
    FAILED,

    /** Can never succeed; dead-letter without retry */
    REJECTED
}
