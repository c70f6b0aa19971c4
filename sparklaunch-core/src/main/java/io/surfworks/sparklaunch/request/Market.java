package io.surfworks.sparklaunch.request;

/**
 * Pricing market for an instance group.
 */
public enum Market {
    /** Fixed-price capacity */
    ON_DEMAND,

    /** Spare capacity, requires a bid price */
    SPOT
}
