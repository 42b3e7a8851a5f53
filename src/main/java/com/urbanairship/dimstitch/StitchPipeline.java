/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One download: plans the batches for a schema, fetches them all through a {@link BatchFetcher}, and
 * stitches the results into a single table.
 * <p>
 * The configuration is checked before anything is fetched, so a {@link ConfigException} always means
 * no request was made.
 */
public class StitchPipeline {
    private static final Logger log = LoggerFactory.getLogger(StitchPipeline.class);

    private final DimensionSchema schema;
    private final BatchPlanner planner;
    private final BatchFetcher batchFetcher;
    private final JoinPolicy joinPolicy;

    public StitchPipeline(DimensionSchema schema, BatchPlanner planner, BatchFetcher batchFetcher,
                          JoinPolicy joinPolicy) {
        this.schema = schema;
        this.planner = planner;
        this.batchFetcher = batchFetcher;
        this.joinPolicy = joinPolicy;
    }

    /**
     * Download every batch and stitch them together. An empty date range gives an empty table, which
     * is not an error.
     */
    public StitchResult run(DateRange dateRange, Optional<String> filter)
            throws ConfigException, FetchException, InterruptedException {
        List<BatchSpec> plan = planner.plan(schema);
        log.info("Downloading " + plan.size() + " batches for " + dateRange);

        List<RowSet> rowSets = batchFetcher.fetchAll(plan, dateRange, filter);

        List<String> warnings = new ArrayList<>();
        if (rowSets.size() < plan.size()) {
            List<BatchSpec> skipped = new ArrayList<>(plan);
            for (RowSet rowSet : rowSets) {
                skipped.remove(rowSet.getBatchSpec());
            }
            String warning = "Output is incomplete, these batches could not be fetched: " + skipped;
            log.warn(warning);
            warnings.add(warning);
        }

        StitchResult stitched = new Stitcher(joinPolicy).stitch(rowSets,
                schema.getStitchDimensions().getDimensionIds());
        log.info("Stitched " + stitched.getRows().size() + " rows from " + rowSets.size() + " batches");

        if (warnings.isEmpty()) {
            return stitched;
        }
        warnings.addAll(stitched.getWarnings());
        return new StitchResult(stitched.getColumns(), stitched.getRows(), warnings);
    }

    /**
     * Download a single batch without stitching, for looking at the user or results rows on their own.
     *
     * @param role {@link GroupRole#USER} or {@link GroupRole#RESULTS}
     */
    public StitchResult runSingle(GroupRole role, DateRange dateRange, Optional<String> filter)
            throws ConfigException, FetchException, InterruptedException {
        RowSet rowSet = fetchSingle(role, dateRange, filter);
        List<CombinedRow> rows = new ArrayList<>(rowSet.size());
        for (Row row : rowSet.getRows()) {
            rows.add(CombinedRow.from(row));
        }
        return new StitchResult(rowSet.getBatchSpec().getDimensionIds(), rows, ImmutableList.<String>of());
    }

    /**
     * @return the number of rows in the user batch and in the results batch, keyed by batch name in that
     * order. A batch skipped under {@link FetchFailurePolicy#BEST_EFFORT} has no entry.
     */
    public Map<String, Integer> countUsersAndResults(DateRange dateRange, Optional<String> filter)
            throws ConfigException, FetchException, InterruptedException {
        List<BatchSpec> plan = planner.plan(schema);
        List<RowSet> rowSets = batchFetcher.fetchAll(ImmutableList.of(
                find(plan, GroupRole.USER), find(plan, GroupRole.RESULTS)), dateRange, filter);
        Map<String, Integer> counts = Maps.newLinkedHashMap();
        for (RowSet rowSet : rowSets) {
            counts.put(rowSet.getBatchSpec().getName(), rowSet.size());
        }
        return counts;
    }

    private RowSet fetchSingle(GroupRole role, DateRange dateRange, Optional<String> filter)
            throws ConfigException, FetchException, InterruptedException {
        BatchSpec batchSpec = find(planner.plan(schema), role);
        return batchFetcher.fetchAll(ImmutableList.of(batchSpec), dateRange, filter).get(0);
    }

    private static BatchSpec find(List<BatchSpec> plan, GroupRole role) {
        for (BatchSpec batchSpec : plan) {
            if (batchSpec.getRole() == role) {
                return batchSpec;
            }
        }
        throw new IllegalArgumentException("No " + role + " batch in " + plan);
    }
}
