/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

/**
 * What the {@link Stitcher} does with a row when a later batch has nothing with the same stitch key.
 *
 * INNER: the row is dropped. This matches the reporting API itself, which returns no row at all when
 * any requested dimension is missing. This is the default.
 *
 * LEFT: the row is kept, with null values for the dimensions of the batch that had no match. Useful
 * for investigating why rows go missing.
 */
public enum JoinPolicy {INNER, LEFT}
