/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import java.util.List;
import java.util.Optional;

/**
 * Runs one batch request against the reporting API. Implementations own authorization, paging,
 * retries, rate limiting and timeouts; callers only see rows or a {@link FetchException}.
 * <p>
 * Implementations must be thread safe, since batches are fetched in parallel.
 */
public interface Fetcher {
    /**
     * @param filter an optional filter expression, passed through untouched to the implementation
     * @return every row for the date range. Each row has a value for exactly the dimensions of the batch.
     * @throws FetchException       if the batch couldn't be fetched
     * @throws InterruptedException if the fetch was cancelled
     */
    List<Row> fetch(BatchSpec batchSpec, DateRange dateRange, Optional<String> filter)
            throws FetchException, InterruptedException;
}
