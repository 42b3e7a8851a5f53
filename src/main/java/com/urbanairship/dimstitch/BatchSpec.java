/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * The set of dimensions requested together in one reporting API call. Normally you should not create
 * your own BatchSpecs but have {@link BatchPlanner} create them, since it checks the request limits.
 */
public class BatchSpec {
    private final String name;
    private final GroupRole role;
    private final List<String> dimensionIds;

    public BatchSpec(String name, GroupRole role, List<String> dimensionIds) {
        this.name = name;
        this.role = role;
        this.dimensionIds = ImmutableList.copyOf(dimensionIds);
    }

    public String getName() {
        return name;
    }

    public GroupRole getRole() {
        return role;
    }

    /**
     * @return the dimension identifiers in request order
     */
    public List<String> getDimensionIds() {
        return dimensionIds;
    }

    public int size() {
        return dimensionIds.size();
    }

    public boolean contains(String dimensionId) {
        return dimensionIds.contains(dimensionId);
    }

    public String toString() {
        return "(" + name + " batch " + dimensionIds + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatchSpec)) return false;
        BatchSpec other = (BatchSpec) o;
        return Objects.equals(name, other.name) && role == other.role
                && dimensionIds.equals(other.dimensionIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, role, dimensionIds);
    }
}
