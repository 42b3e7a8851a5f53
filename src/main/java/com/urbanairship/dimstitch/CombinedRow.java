/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A row of the stitched table, holding the values of every batch that was joined into it. A dimension
 * whose batch had no matching row under {@link JoinPolicy#LEFT} is present with a null value.
 * <p>
 * Immutable. Joining makes a new CombinedRow.
 */
public class CombinedRow {
    private final Map<String, String> values;

    private CombinedRow(LinkedHashMap<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CombinedRow from(Row row) {
        return new CombinedRow(new LinkedHashMap<>(row.getValues()));
    }

    /**
     * @return a new row with this row's values and the other row's values. Where both have a value for
     * the same dimension, the other row's value wins.
     */
    public CombinedRow join(Row other) {
        LinkedHashMap<String, String> joined = new LinkedHashMap<>(values);
        joined.putAll(other.getValues());
        return new CombinedRow(joined);
    }

    /**
     * @return a new row with a null value for each given dimension this row doesn't have. Dimensions it
     * already has keep their values.
     */
    public CombinedRow withNulls(Collection<String> dimensionIds) {
        LinkedHashMap<String, String> filled = new LinkedHashMap<>(values);
        for (String id : dimensionIds) {
            if (!filled.containsKey(id)) {
                filled.put(id, null);
            }
        }
        return new CombinedRow(filled);
    }

    StitchKey stitchKey(List<String> stitchDimensionIds) throws MissingStitchValueException {
        return StitchKey.of(values, stitchDimensionIds);
    }

    /**
     * @return the value, or null if the dimension is absent or was null filled
     */
    public String get(String dimensionId) {
        return values.get(dimensionId);
    }

    public boolean has(String dimensionId) {
        return values.containsKey(dimensionId);
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
        if (!(o instanceof CombinedRow)) return false;
        return values.equals(((CombinedRow) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }
}
