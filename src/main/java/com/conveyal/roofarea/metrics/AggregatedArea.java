package com.conveyal.roofarea.metrics;

import java.util.Objects;

/** Total area of all features sharing one group key, a building or tile identifier. */
public final class AggregatedArea {

    /** The building_id or tile_id value shared by the features in this group. Never null. */
    public final Object groupKey;

    public final double totalAreaM2;

    public AggregatedArea (Object groupKey, double totalAreaM2) {
        this.groupKey = Objects.requireNonNull(groupKey);
        this.totalAreaM2 = totalAreaM2;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        AggregatedArea that = (AggregatedArea) other;
        return groupKey.equals(that.groupKey) && Double.compare(totalAreaM2, that.totalAreaM2) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(groupKey, totalAreaM2);
    }

    @Override
    public String toString () {
        return groupKey + ": " + totalAreaM2 + " m²";
    }

}
