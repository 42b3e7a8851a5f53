/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * One row of a reporting API response: a value for each dimension that was requested in the batch.
 * The API drops any row that is missing one of the requested dimensions, so a well formed Row has
 * every dimension of its batch.
 */
public class Row {
    private final ImmutableMap<String, String> values;

    public Row(Map<String, String> values) {
        this.values = ImmutableMap.copyOf(values);
    }

    /**
     * Build a row from values given in the same order as the dimensions of a batch, which is the way the
     * reporting API returns them.
     */
    public static Row fromValues(List<String> dimensionIds, List<String> values) {
        Preconditions.checkArgument(dimensionIds.size() == values.size(),
                "Got %s values for %s dimensions", values.size(), dimensionIds.size());
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (int i = 0; i < dimensionIds.size(); i++) {
            builder.put(dimensionIds.get(i), values.get(i));
        }
        return new Row(builder.build());
    }

    public static Row of(String k1, String v1) {
        return new Row(ImmutableMap.of(Dimension.qualify(k1), v1));
    }

    public static Row of(String k1, String v1, String k2, String v2) {
        return new Row(ImmutableMap.of(Dimension.qualify(k1), v1, Dimension.qualify(k2), v2));
    }

    public static Row of(String k1, String v1, String k2, String v2, String k3, String v3) {
        return new Row(ImmutableMap.of(Dimension.qualify(k1), v1, Dimension.qualify(k2), v2,
                Dimension.qualify(k3), v3));
    }

    /**
     * @return the value, or null if this row has no value for the dimension
     */
    public String get(String dimensionId) {
        return values.get(dimensionId);
    }

    public Map<String, String> getValues() {
        return values;
    }

    public String toString() {
        return values.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
