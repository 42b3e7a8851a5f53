/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of dimension identifiers that play the same {@link GroupRole}. The order is the
 * order the dimensions were declared in and is kept all the way through to the output columns.
 */
public class DimensionGroup {
    private final GroupRole role;
    private final int ordinal;
    private final List<String> dimensionIds;

    /**
     * @param ordinal only meaningful for {@link GroupRole#ADDITIONAL} groups, where it is the N of the
     *                "batch-dimensions-N" section the group came from. Other roles use 0.
     */
    public DimensionGroup(GroupRole role, int ordinal, List<String> dimensionIds) {
        this.role = Preconditions.checkNotNull(role);
        this.ordinal = ordinal;
        List<String> qualified = new ArrayList<>(dimensionIds.size());
        for (String id : dimensionIds) {
            qualified.add(Dimension.qualify(id));
        }
        this.dimensionIds = ImmutableList.copyOf(qualified);
    }

    public DimensionGroup(GroupRole role, List<String> dimensionIds) {
        this(role, 0, dimensionIds);
    }

    public static DimensionGroup of(GroupRole role, String... dimensionIds) {
        return new DimensionGroup(role, ImmutableList.copyOf(dimensionIds));
    }

    public static DimensionGroup additional(int ordinal, String... dimensionIds) {
        return new DimensionGroup(GroupRole.ADDITIONAL, ordinal, ImmutableList.copyOf(dimensionIds));
    }

    public GroupRole getRole() {
        return role;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public List<String> getDimensionIds() {
        return dimensionIds;
    }

    public int size() {
        return dimensionIds.size();
    }

    public boolean isEmpty() {
        return dimensionIds.isEmpty();
    }

    /**
     * The first declared dimension. For user and results groups this is the anchor that both must share.
     */
    public String first() {
        return dimensionIds.get(0);
    }

    /**
     * The name used in logs and error messages, matching the configuration section it came from.
     */
    public String getName() {
        switch (role) {
            case USER:
                return "user-dimensions";
            case RESULTS:
                return "results-dimensions";
            case ADDITIONAL:
                return "batch-dimensions-" + ordinal;
            case STITCH:
                return "stitch-dimensions";
            default:
                throw new RuntimeException("Unknown group role " + role);
        }
    }

    public String toString() {
        return getName() + dimensionIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DimensionGroup)) return false;
        DimensionGroup other = (DimensionGroup) o;
        return role == other.role && ordinal == other.ordinal && dimensionIds.equals(other.dimensionIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, ordinal, dimensionIds);
    }
}
