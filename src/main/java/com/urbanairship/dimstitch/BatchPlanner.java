/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a {@link DimensionSchema} into the list of requests that have to be made to download it.
 * Each request must fit within the reporting API's dimension limit and must contain the stitch
 * dimensions, otherwise its rows couldn't be joined back together.
 * <p>
 * The batches always come out in the same order: user, results, then the additional groups in the
 * order they were declared. The first batch is the base table that the {@link Stitcher} joins
 * everything else onto, so this order decides the order of the output.
 * <p>
 * Stateless and thread safe.
 */
public class BatchPlanner {
    private static final Logger log = LoggerFactory.getLogger(BatchPlanner.class);

    /**
     * The reporting API rejects requests with more dimensions than this.
     */
    public static final int MAX_DIMENSIONS_PER_REQUEST = 7;

    public List<BatchSpec> plan(DimensionSchema schema) throws ConfigException {
        return plan(schema.getUserDimensions(), schema.getResultsDimensions(),
                schema.getAdditionalDimensions(), schema.getStitchDimensions());
    }

    /**
     * @throws ConfigException if the groups can't be requested and stitched back together, with a
     *                         message saying which rule was broken.
     */
    public List<BatchSpec> plan(DimensionGroup userDims, DimensionGroup resultsDims,
                                List<DimensionGroup> additionalGroups, DimensionGroup stitchDims)
            throws ConfigException {
        if (stitchDims == null || stitchDims.isEmpty()) {
            throw new ConfigException("At least one stitch dimension is required to join batches together");
        }
        checkNoDuplicates(stitchDims);
        if (stitchDims.size() > MAX_DIMENSIONS_PER_REQUEST) {
            throw new ConfigException("There are " + stitchDims.size() + " stitch dimensions but a request " +
                    "may have at most " + MAX_DIMENSIONS_PER_REQUEST + " dimensions");
        }

        List<DimensionGroup> groups = new ArrayList<>(additionalGroups.size() + 2);
        groups.add(userDims);
        groups.add(resultsDims);
        groups.addAll(additionalGroups);

        ImmutableList.Builder<BatchSpec> specs = ImmutableList.builder();
        for (DimensionGroup group : groups) {
            specs.add(toBatchSpec(group, stitchDims));
        }

        // The user and results groups must share their first dimension, it identifies the user
        if (!userDims.first().equals(resultsDims.first())) {
            throw new ConfigException("The first dimension of " + userDims.getName() + " (" + userDims.first() +
                    ") and " + resultsDims.getName() + " (" + resultsDims.first() + ") must be equal");
        }

        List<BatchSpec> plan = specs.build();
        if (log.isDebugEnabled()) {
            log.debug("Planned " + plan.size() + " batches: " + plan);
        }
        return plan;
    }

    private BatchSpec toBatchSpec(DimensionGroup group, DimensionGroup stitchDims) throws ConfigException {
        if (group.isEmpty()) {
            throw new ConfigException("Dimension group " + group.getName() + " is empty");
        }
        checkNoDuplicates(group);

        // Declared order first, then whichever stitch dimensions the group didn't already ask for
        Set<String> dimensionIds = new LinkedHashSet<>(group.getDimensionIds());
        dimensionIds.addAll(stitchDims.getDimensionIds());

        if (dimensionIds.size() > MAX_DIMENSIONS_PER_REQUEST) {
            Set<String> added = Sets.difference(dimensionIds, new LinkedHashSet<>(group.getDimensionIds()));
            throw new ConfigException("Dimension group " + group.getName() + " needs " + dimensionIds.size() +
                    " dimensions including the stitch dimensions " + added + " but a request may have at most " +
                    MAX_DIMENSIONS_PER_REQUEST);
        }

        return new BatchSpec(group.getName(), group.getRole(), new ArrayList<>(dimensionIds));
    }

    private static void checkNoDuplicates(DimensionGroup group) throws ConfigException {
        Set<String> seen = Sets.newHashSet();
        for (String id : group.getDimensionIds()) {
            if (!seen.add(id)) {
                throw new ConfigException("Dimension " + id + " appears more than once in " + group.getName());
            }
        }
    }
}
