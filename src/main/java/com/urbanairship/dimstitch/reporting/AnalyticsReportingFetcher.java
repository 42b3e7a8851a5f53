/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch.reporting;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import com.google.api.services.analyticsreporting.v4.model.ColumnHeader;
import com.google.api.services.analyticsreporting.v4.model.DimensionFilterClause;
import com.google.api.services.analyticsreporting.v4.model.GetReportsRequest;
import com.google.api.services.analyticsreporting.v4.model.GetReportsResponse;
import com.google.api.services.analyticsreporting.v4.model.Metric;
import com.google.api.services.analyticsreporting.v4.model.Report;
import com.google.api.services.analyticsreporting.v4.model.ReportRequest;
import com.google.api.services.analyticsreporting.v4.model.ReportRow;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.urbanairship.dimstitch.BatchSpec;
import com.urbanairship.dimstitch.DateRange;
import com.urbanairship.dimstitch.FetchException;
import com.urbanairship.dimstitch.Fetcher;
import com.urbanairship.dimstitch.Row;
import com.urbanairship.dimstitch.config.DownloadConfiguration;
import com.urbanairship.dimstitch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fetches one batch as a Reporting API v4 report, following page tokens until the report is complete.
 * Each request asks for the batch's dimensions and the ga:users metric; only the dimension values are
 * kept.
 * <p>
 * Failed requests are retried according to a {@link RetryPolicy}, except for errors that will not go
 * away by asking again, like a bad request or missing permissions. Safe to share between threads.
 */
public class AnalyticsReportingFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsReportingFetcher.class);

    public static final String METRIC = "ga:users";

    // 403 reasons that mean "slow down", as opposed to "not allowed"
    private static final Set<String> RATE_LIMIT_REASONS = ImmutableSet.of(
            "rateLimitExceeded", "userRateLimitExceeded", "quotaExceeded");

    private final ReportsClient client;
    private final String viewId;
    private final int pageSize;
    private final boolean stripNonAscii;
    private final RetryPolicy retryPolicy;

    private final Timer requestTimer;
    private final Meter pagesFetched;
    private final Meter failedRequests;
    private final Meter retries;

    public AnalyticsReportingFetcher(ReportsClient client, DownloadConfiguration config) {
        this(client, config.viewId, config.maxResults, config.stripNonAscii,
                new RetryPolicy.Jittered(config.numTries));
    }

    public AnalyticsReportingFetcher(ReportsClient client, String viewId, int pageSize, boolean stripNonAscii,
                                     RetryPolicy retryPolicy) {
        this.client = client;
        this.viewId = viewId;
        this.pageSize = pageSize;
        this.stripNonAscii = stripNonAscii;
        this.retryPolicy = retryPolicy;

        requestTimer = Metrics.timer(AnalyticsReportingFetcher.class, "requestLatency");
        pagesFetched = Metrics.meter(AnalyticsReportingFetcher.class, "pagesFetched");
        failedRequests = Metrics.meter(AnalyticsReportingFetcher.class, "failedRequests");
        retries = Metrics.meter(AnalyticsReportingFetcher.class, "retries");
    }

    @Override
    public List<Row> fetch(BatchSpec batchSpec, DateRange dateRange, Optional<String> filter)
            throws FetchException, InterruptedException {
        DimensionFilterClause filterClause = null;
        if (filter.isPresent()) {
            try {
                filterClause = DimensionFilterExpression.parse(filter.get()).toClause();
            } catch (IllegalArgumentException e) {
                throw new FetchException(batchSpec, e.getMessage(), e);
            }
        }

        List<Row> rows = new ArrayList<>();
        String pageToken = null;
        int pages = 0;
        do {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while fetching " + batchSpec);
            }

            ReportRequest request = newRequest(batchSpec, dateRange, filterClause, pageToken);
            if (log.isDebugEnabled()) {
                log.debug("Report request for " + batchSpec + ": " + request);
            }
            Report report = execute(batchSpec, request);
            int pageRows = readRows(batchSpec, report, rows);
            pagesFetched.mark();
            pages++;

            String nextPageToken = report.getNextPageToken();
            if (nextPageToken != null && nextPageToken.equals(pageToken)) {
                throw new FetchException(batchSpec, "Malformed response, page token " + pageToken + " repeated");
            }
            if (log.isDebugEnabled()) {
                log.debug("Page " + pages + " of " + batchSpec + " had " + pageRows + " rows" +
                        (nextPageToken == null ? " (no next page)" : ", next page token " + nextPageToken));
            }
            pageToken = nextPageToken;
        } while (pageToken != null);

        return rows;
    }

    private ReportRequest newRequest(BatchSpec batchSpec, DateRange dateRange, DimensionFilterClause filterClause,
                                     String pageToken) {
        List<com.google.api.services.analyticsreporting.v4.model.Dimension> dimensions = new ArrayList<>();
        for (String dimensionId : batchSpec.getDimensionIds()) {
            dimensions.add(new com.google.api.services.analyticsreporting.v4.model.Dimension().setName(dimensionId));
        }

        ReportRequest request = new ReportRequest()
                .setViewId(viewId)
                .setPageSize(pageSize)
                .setDimensions(dimensions)
                .setMetrics(ImmutableList.of(new Metric().setExpression(METRIC)))
                .setDateRanges(ImmutableList.of(new com.google.api.services.analyticsreporting.v4.model.DateRange()
                        .setStartDate(dateRange.getStartDate())
                        .setEndDate(dateRange.getEndDate())));
        if (filterClause != null) {
            request.setDimensionFilterClauses(ImmutableList.of(filterClause));
        }
        if (pageToken != null) {
            request.setPageToken(pageToken);
        }
        return request;
    }

    private Report execute(BatchSpec batchSpec, ReportRequest request) throws FetchException, InterruptedException {
        GetReportsRequest getReportsRequest = new GetReportsRequest().setReportRequests(ImmutableList.of(request));
        int attempt = 0;
        while (true) {
            GetReportsResponse response;
            Timer.Context timer = requestTimer.time();
            try {
                response = client.batchGet(getReportsRequest);
            } catch (IOException e) {
                failedRequests.mark();
                if (!isRetryable(e)) {
                    throw new FetchException(batchSpec, "Request was rejected: " + e.getMessage(), e);
                }
                if (!retryPolicy.sleep(attempt)) {
                    throw new FetchException(batchSpec, "Request still failing after " + (attempt + 1) + " tries",
                            e);
                }
                retries.mark();
                attempt++;
                log.warn("Retrying request for " + batchSpec + ", try " + (attempt + 1) + " after: " + e.getMessage());
                continue;
            } finally {
                timer.stop();
            }

            if (response == null || response.getReports() == null || response.getReports().size() != 1) {
                throw new FetchException(batchSpec, "Malformed response, expected exactly one report: " + response);
            }
            return response.getReports().get(0);
        }
    }

    private int readRows(BatchSpec batchSpec, Report report, List<Row> rows) throws FetchException {
        List<String> dimensionIds = batchSpec.getDimensionIds();

        ColumnHeader columnHeader = report.getColumnHeader();
        if (columnHeader != null && columnHeader.getDimensions() != null &&
                !columnHeader.getDimensions().equals(dimensionIds)) {
            throw new FetchException(batchSpec, "Malformed response, column header " +
                    columnHeader.getDimensions() + " doesn't match the requested dimensions");
        }

        // An empty report has no rows at all rather than an empty list
        if (report.getData() == null || report.getData().getRows() == null) {
            return 0;
        }

        List<ReportRow> reportRows = report.getData().getRows();
        for (ReportRow reportRow : reportRows) {
            List<String> values = reportRow.getDimensions();
            if (values == null || values.size() != dimensionIds.size() || values.contains(null)) {
                throw new FetchException(batchSpec, "Malformed response, row " + values + " doesn't have " +
                        dimensionIds.size() + " dimension values");
            }
            if (stripNonAscii) {
                List<String> stripped = new ArrayList<>(values.size());
                for (String value : values) {
                    stripped.add(CharMatcher.ascii().retainFrom(value));
                }
                values = stripped;
            }
            rows.add(Row.fromValues(dimensionIds, values));
        }
        return reportRows.size();
    }

    static boolean isRetryable(IOException e) {
        if (!(e instanceof HttpResponseException)) {
            // Connection resets, timeouts and the like
            return true;
        }
        int statusCode = ((HttpResponseException) e).getStatusCode();
        if (statusCode == 429 || statusCode >= 500) {
            return true;
        }
        if (statusCode == 403 && e instanceof GoogleJsonResponseException) {
            GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
            if (details != null && details.getErrors() != null) {
                for (GoogleJsonError.ErrorInfo errorInfo : details.getErrors()) {
                    if (RATE_LIMIT_REASONS.contains(errorInfo.getReason())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
