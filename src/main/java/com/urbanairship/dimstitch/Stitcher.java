/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.codahale.metrics.Counter;
import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.urbanairship.dimstitch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins the row sets of several batches back into one table, using the stitch dimensions as the
 * join key.
 * <p>
 * The first row set (the user batch) is the base table, with one row per stitch key. Each following
 * row set is hash joined onto the table built so far, in the order given. A batch usually has many
 * rows per key (many events per user), so each table row can turn into many rows; that growth is
 * expected. When a table row has no match in a batch, the {@link JoinPolicy} decides whether it is
 * dropped or kept with null values.
 * <p>
 * The order of the output follows the order of the base table and then of each batch's rows, so the
 * same input always gives the same output. Reordering the later batches changes only the row order,
 * not the rows, as long as the stitch values agree across batches.
 * <p>
 * Rows without a value for a stitch dimension can't be joined. They are dropped with a warning
 * rather than failing the run.
 * <p>
 * Not thread safe, use one Stitcher per run.
 */
public class Stitcher {
    private static final Logger log = LoggerFactory.getLogger(Stitcher.class);

    private final JoinPolicy joinPolicy;
    private final List<String> warnings = new ArrayList<>();

    private final Counter duplicateBaseKeys;
    private final Counter rowsMissingStitchValue;
    private final Counter unmatchedRows;

    public Stitcher(JoinPolicy joinPolicy) {
        this.joinPolicy = Preconditions.checkNotNull(joinPolicy);
        duplicateBaseKeys = Metrics.counter(Stitcher.class, "duplicateBaseKeys");
        rowsMissingStitchValue = Metrics.counter(Stitcher.class, "rowsMissingStitchValue");
        unmatchedRows = Metrics.counter(Stitcher.class, "unmatchedRows", joinPolicy.name().toLowerCase());
    }

    public Stitcher() {
        this(JoinPolicy.INNER);
    }

    /**
     * @param rowSetsInPlanOrder one row set per batch, base table first
     * @param stitchDimensionIds the join key dimensions, which every batch must have requested
     */
    public StitchResult stitch(List<RowSet> rowSetsInPlanOrder, List<String> stitchDimensionIds) {
        Preconditions.checkArgument(!rowSetsInPlanOrder.isEmpty(), "Nothing to stitch");
        Preconditions.checkArgument(!stitchDimensionIds.isEmpty(), "No stitch dimensions");
        warnings.clear();

        Set<String> columns = new LinkedHashSet<>();
        for (RowSet rowSet : rowSetsInPlanOrder) {
            columns.addAll(rowSet.getBatchSpec().getDimensionIds());
        }

        RowSet base = rowSetsInPlanOrder.get(0);
        List<CombinedRow> table = baseTable(base, stitchDimensionIds);
        if (log.isDebugEnabled()) {
            log.debug("Base table " + base.getBatchSpec() + " has " + table.size() + " rows");
        }

        for (RowSet incoming : rowSetsInPlanOrder.subList(1, rowSetsInPlanOrder.size())) {
            table = join(table, incoming, stitchDimensionIds);
            if (log.isDebugEnabled()) {
                log.debug("After joining " + incoming.getBatchSpec() + " the table has " + table.size() + " rows");
            }
        }

        return new StitchResult(ImmutableList.copyOf(columns), table, warnings);
    }

    /**
     * One row per stitch key. If a key is repeated the last row wins, since user dimensions are expected
     * to have a single value per key.
     */
    private List<CombinedRow> baseTable(RowSet base, List<String> stitchDimensionIds) {
        Map<StitchKey, Row> index = Maps.newLinkedHashMap();
        for (Row row : base.getRows()) {
            StitchKey key;
            try {
                key = StitchKey.of(row.getValues(), stitchDimensionIds);
            } catch (MissingStitchValueException e) {
                dropMissingStitchValue(base.getBatchSpec(), e);
                continue;
            }

            Row previous = index.put(key, row);
            if (previous != null) {
                duplicateBaseKeys.inc();
                warn("Duplicate stitch key " + key + " in base batch " + base.getBatchSpec().getName() +
                        ", keeping the last row " + row + " over " + previous);
            }
        }

        List<CombinedRow> table = new ArrayList<>(index.size());
        for (Row row : index.values()) {
            table.add(CombinedRow.from(row));
        }
        return table;
    }

    private List<CombinedRow> join(List<CombinedRow> table, RowSet incoming, List<String> stitchDimensionIds) {
        ListMultimap<StitchKey, Row> index = ArrayListMultimap.create();
        for (Row row : incoming.getRows()) {
            try {
                index.put(StitchKey.of(row.getValues(), stitchDimensionIds), row);
            } catch (MissingStitchValueException e) {
                dropMissingStitchValue(incoming.getBatchSpec(), e);
            }
        }

        List<String> incomingDimensionIds = incoming.getBatchSpec().getDimensionIds();
        List<CombinedRow> joined = new ArrayList<>(Math.max(table.size(), index.size()));
        long unmatched = 0;
        for (CombinedRow existing : table) {
            StitchKey key;
            try {
                key = existing.stitchKey(stitchDimensionIds);
            } catch (MissingStitchValueException e) {
                // Every table row started out as a keyed base row
                throw new IllegalStateException("Stitched row lost its key", e);
            }

            List<Row> matches = index.get(key);
            if (matches.isEmpty()) {
                unmatched++;
                if (joinPolicy == JoinPolicy.LEFT) {
                    joined.add(existing.withNulls(incomingDimensionIds));
                }
                continue;
            }

            for (Row match : matches) {
                joined.add(existing.join(match));
            }
        }

        if (unmatched > 0) {
            unmatchedRows.inc(unmatched);
            log.info(unmatched + " of " + table.size() + " rows had no match in " + incoming.getBatchSpec() +
                    (joinPolicy == JoinPolicy.INNER ? " and were dropped" : " and were kept with empty values"));
        }
        return joined;
    }

    private void dropMissingStitchValue(BatchSpec batchSpec, MissingStitchValueException e) {
        rowsMissingStitchValue.inc();
        warn("Dropping row from " + batchSpec.getName() + ": " + e.getMessage());
    }

    private void warn(String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}
