/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The values of the stitch dimensions of a row, in stitch dimension order. Rows from different
 * batches with equal keys are joined together.
 * <p>
 * Values are compared as exact strings. An empty string is a real value and doesn't match anything
 * but another empty string.
 */
public class StitchKey {
    private static final Joiner KEY_JOINER = Joiner.on(" && ");

    private final List<String> values;

    public StitchKey(List<String> values) {
        this.values = ImmutableList.copyOf(values);
    }

    /**
     * @throws MissingStitchValueException if the row has no value for one of the stitch dimensions
     */
    public static StitchKey of(Map<String, String> row, List<String> stitchDimensionIds)
            throws MissingStitchValueException {
        List<String> keyValues = new ArrayList<>(stitchDimensionIds.size());
        for (String id : stitchDimensionIds) {
            String value = row.get(id);
            if (value == null) {
                throw new MissingStitchValueException(id, row);
            }
            keyValues.add(value);
        }
        return new StitchKey(keyValues);
    }

    public List<String> getValues() {
        return values;
    }

    public String toString() {
        return "[" + KEY_JOINER.join(values) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StitchKey)) return false;
        return values.equals(((StitchKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
