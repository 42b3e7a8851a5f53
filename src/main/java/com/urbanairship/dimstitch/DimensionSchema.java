/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Describes which dimensions a download asks for and how they are grouped into requests: the user
 * group, the results group, any number of additional groups, and the stitch dimensions that every
 * request shares. Also holds the display labels ("translations") for dimensions.
 *
 * Immutable. The invariants between the groups are checked by {@link BatchPlanner}.
 */
public class DimensionSchema {
    private final DimensionGroup userDimensions;
    private final DimensionGroup resultsDimensions;
    private final List<DimensionGroup> additionalDimensions;
    private final DimensionGroup stitchDimensions;
    private final Map<String, String> translations;

    public DimensionSchema(DimensionGroup userDimensions, DimensionGroup resultsDimensions,
                           List<DimensionGroup> additionalDimensions, DimensionGroup stitchDimensions,
                           Map<String, String> translations) {
        this.userDimensions = checkRole(userDimensions, GroupRole.USER);
        this.resultsDimensions = checkRole(resultsDimensions, GroupRole.RESULTS);
        for (DimensionGroup group : additionalDimensions) {
            checkRole(group, GroupRole.ADDITIONAL);
        }
        this.additionalDimensions = ImmutableList.copyOf(additionalDimensions);
        this.stitchDimensions = checkRole(stitchDimensions, GroupRole.STITCH);

        ImmutableMap.Builder<String, String> qualified = ImmutableMap.builder();
        for (Map.Entry<String, String> e : translations.entrySet()) {
            qualified.put(Dimension.qualify(e.getKey()), e.getValue());
        }
        this.translations = qualified.build();
    }

    public DimensionSchema(DimensionGroup userDimensions, DimensionGroup resultsDimensions,
                           List<DimensionGroup> additionalDimensions, DimensionGroup stitchDimensions) {
        this(userDimensions, resultsDimensions, additionalDimensions, stitchDimensions,
                ImmutableMap.<String, String>of());
    }

    private static DimensionGroup checkRole(DimensionGroup group, GroupRole expected) {
        Preconditions.checkNotNull(group, "Missing %s group", expected);
        Preconditions.checkArgument(group.getRole() == expected,
                "Expected a %s group but got %s", expected, group.getRole());
        return group;
    }

    public DimensionGroup getUserDimensions() {
        return userDimensions;
    }

    public DimensionGroup getResultsDimensions() {
        return resultsDimensions;
    }

    public List<DimensionGroup> getAdditionalDimensions() {
        return additionalDimensions;
    }

    public DimensionGroup getStitchDimensions() {
        return stitchDimensions;
    }

    public Map<String, String> getTranslations() {
        return translations;
    }

    /**
     * @return the dimension with its display label, or labelled with its own identifier if there is no
     * translation configured for it.
     */
    public Dimension getDimension(String id) {
        String qualified = Dimension.qualify(id);
        return new Dimension(qualified, translations.get(qualified));
    }
}
