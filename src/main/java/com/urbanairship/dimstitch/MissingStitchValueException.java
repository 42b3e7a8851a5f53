/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

/**
 * Thrown when a row has no value for one of the stitch dimensions, so it has no key to be joined on.
 * The reporting API shouldn't return such rows. The {@link Stitcher} drops them and carries on.
 */
public class MissingStitchValueException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String dimensionId;

    public MissingStitchValueException(String dimensionId, Object row) {
        super("Row has no value for stitch dimension " + dimensionId + ": " + row);
        this.dimensionId = dimensionId;
    }

    public String getDimensionId() {
        return dimensionId;
    }
}
