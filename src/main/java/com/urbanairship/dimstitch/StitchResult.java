/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The output of the {@link Stitcher}: the combined rows, the columns they should be written with, and
 * any warnings about rows that had to be dropped or overwritten along the way.
 */
public class StitchResult {
    private final List<String> columns;
    private final List<CombinedRow> rows;
    private final List<String> warnings;

    public StitchResult(List<String> columns, List<CombinedRow> rows, List<String> warnings) {
        this.columns = ImmutableList.copyOf(columns);
        this.rows = ImmutableList.copyOf(rows);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    /**
     * @return the dimension identifiers of every batch that was stitched, in plan order, without repeats
     */
    public List<String> getColumns() {
        return columns;
    }

    public List<CombinedRow> getRows() {
        return rows;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
