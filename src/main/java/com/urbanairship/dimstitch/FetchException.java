/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import java.io.IOException;

/**
 * A batch request to the reporting API failed, whether because of the network, authorization, quota,
 * a timeout or a response we couldn't make sense of. Carries the {@link BatchSpec} that failed so the
 * caller can decide whether the run can go on without it.
 */
public class FetchException extends IOException {
    private static final long serialVersionUID = 1L;

    private final BatchSpec batchSpec;

    public FetchException(BatchSpec batchSpec, String msg) {
        super(msg + " " + batchSpec);
        this.batchSpec = batchSpec;
    }

    public FetchException(BatchSpec batchSpec, Throwable cause) {
        super("Fetch failed for " + batchSpec, cause);
        this.batchSpec = batchSpec;
    }

    public FetchException(BatchSpec batchSpec, String msg, Throwable cause) {
        super(msg + " " + batchSpec, cause);
        this.batchSpec = batchSpec;
    }

    public BatchSpec getBatchSpec() {
        return batchSpec;
    }
}
