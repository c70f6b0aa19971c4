package io.surfworks.sparklaunch.request;

import java.util.Objects;

/**
 * One instance group of a cluster.
 *
 * @param role          MASTER or CORE
 * @param instanceType  EC2 instance type, e.g. "m3.xlarge"
 * @param instanceCount number of instances in the group
 * @param market        ON_DEMAND or SPOT
 * @param bidPrice      bid price as a decimal string (only for SPOT, null otherwise)
 */
public record InstanceGroupSpec(
        InstanceRole role,
        String instanceType,
        int instanceCount,
        Market market,
        String bidPrice
) {

    public InstanceGroupSpec {
        Objects.requireNonNull(role, "role cannot be null");
        Objects.requireNonNull(instanceType, "instanceType cannot be null");
        Objects.requireNonNull(market, "market cannot be null");

        if (instanceType.isBlank()) {
            throw new IllegalArgumentException("instanceType cannot be blank");
        }
        if (instanceCount < 1) {
            throw new IllegalArgumentException("instanceCount must be positive: " + instanceCount);
        }
        if (role == InstanceRole.MASTER && instanceCount != 1) {
            throw new IllegalArgumentException("MASTER group must have exactly 1 instance, got " + instanceCount);
        }
        if (market == Market.SPOT && (bidPrice == null || bidPrice.isBlank())) {
            throw new IllegalArgumentException("SPOT market requires a bid price");
        }
        if (market == Market.ON_DEMAND && bidPrice != null) {
            throw new IllegalArgumentException("ON_DEMAND market cannot carry a bid price");
        }
    }

    /**
     * Returns true if this group bids for spot capacity.
     */
    public boolean isSpot() {
        return market == Market.SPOT;
    }
}
