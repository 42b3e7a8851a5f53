/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

/**
 * The part a {@link DimensionGroup} plays in a download.
 *
 * USER: dimensions that are constant for a user, for example country. The user batch is the base
 * table that every other batch is stitched onto.
 *
 * RESULTS: dimensions that vary per event, for example event category.
 *
 * ADDITIONAL: any further group of dimensions that didn't fit in the user or results requests.
 *
 * STITCH: the dimensions requested in every batch and used as the join key.
 */
public enum GroupRole {USER, RESULTS, ADDITIONAL, STITCH}
