/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * All the rows fetched for one {@link BatchSpec}.
 */
public class RowSet {
    private final BatchSpec batchSpec;
    private final List<Row> rows;

    public RowSet(BatchSpec batchSpec, List<Row> rows) {
        this.batchSpec = batchSpec;
        this.rows = ImmutableList.copyOf(rows);
    }

    public BatchSpec getBatchSpec() {
        return batchSpec;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public String toString() {
        return batchSpec + " with " + rows.size() + " rows";
    }
}
