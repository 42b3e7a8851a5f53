package com.urbanairship.dimstitch.reporting;

import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.services.analyticsreporting.v4.model.ColumnHeader;
import com.google.api.services.analyticsreporting.v4.model.GetReportsRequest;
import com.google.api.services.analyticsreporting.v4.model.GetReportsResponse;
import com.google.api.services.analyticsreporting.v4.model.Report;
import com.google.api.services.analyticsreporting.v4.model.ReportData;
import com.google.api.services.analyticsreporting.v4.model.ReportRequest;
import com.google.api.services.analyticsreporting.v4.model.ReportRow;
import com.google.common.collect.ImmutableList;
import com.urbanairship.dimstitch.BatchSpec;
import com.urbanairship.dimstitch.DateRange;
import com.urbanairship.dimstitch.FetchException;
import com.urbanairship.dimstitch.GroupRole;
import com.urbanairship.dimstitch.Row;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AnalyticsReportingFetcherTest {
    private static final BatchSpec RESULTS = new BatchSpec("results-dimensions", GroupRole.RESULTS,
            ImmutableList.of("ga:dimension1", "ga:eventCategory"));
    private static final DateRange DATES = DateRange.of("2020-01-01", "2020-01-31");

    /**
     * Allows three tries without sleeping.
     */
    private static final RetryPolicy NO_SLEEP = new RetryPolicy() {
        @Override
        public boolean sleep(int attempt) {
            return attempt + 1 < 3;
        }
    };

    @Mock
    private ReportsClient client;

    private AnalyticsReportingFetcher fetcher;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        fetcher = new AnalyticsReportingFetcher(client, "123456", 2, true, NO_SLEEP);
    }

    @SafeVarargs
    private static GetReportsResponse response(String nextPageToken, List<String>... rows) {
        List<ReportRow> reportRows = new ArrayList<>();
        for (List<String> row : rows) {
            reportRows.add(new ReportRow().setDimensions(row));
        }
        Report report = new Report()
                .setColumnHeader(new ColumnHeader().setDimensions(RESULTS.getDimensionIds()))
                .setData(new ReportData().setRows(reportRows))
                .setNextPageToken(nextPageToken);
        return new GetReportsResponse().setReports(ImmutableList.of(report));
    }

    private static HttpResponseException httpError(int statusCode) {
        return new HttpResponseException.Builder(statusCode, "HTTP BOOM!", new HttpHeaders()).build();
    }

    @Test
    public void testPaging() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenReturn(
                response("2", ImmutableList.of("u1", "click"), ImmutableList.of("u1", "view")),
                response(null, ImmutableList.of("u2", "click")));

        List<Row> rows = fetcher.fetch(RESULTS, DATES, Optional.<String>empty());

        assertEquals(ImmutableList.of(
                Row.of("dimension1", "u1", "eventCategory", "click"),
                Row.of("dimension1", "u1", "eventCategory", "view"),
                Row.of("dimension1", "u2", "eventCategory", "click")), rows);

        ArgumentCaptor<GetReportsRequest> requests = ArgumentCaptor.forClass(GetReportsRequest.class);
        verify(client, times(2)).batchGet(requests.capture());
        ReportRequest first = requests.getAllValues().get(0).getReportRequests().get(0);
        ReportRequest second = requests.getAllValues().get(1).getReportRequests().get(0);
        assertNull(first.getPageToken());
        assertEquals("2", second.getPageToken());
    }

    @Test
    public void testRequest() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenReturn(response(null));

        fetcher.fetch(RESULTS, DATES, Optional.of("ga:eventCategory EXACT click"));

        ArgumentCaptor<GetReportsRequest> captor = ArgumentCaptor.forClass(GetReportsRequest.class);
        verify(client).batchGet(captor.capture());
        assertEquals(1, captor.getValue().getReportRequests().size());
        ReportRequest request = captor.getValue().getReportRequests().get(0);

        assertEquals("123456", request.getViewId());
        assertEquals(Integer.valueOf(2), request.getPageSize());
        assertEquals(2, request.getDimensions().size());
        assertEquals("ga:dimension1", request.getDimensions().get(0).getName());
        assertEquals("ga:eventCategory", request.getDimensions().get(1).getName());
        assertEquals(AnalyticsReportingFetcher.METRIC, request.getMetrics().get(0).getExpression());
        assertEquals("2020-01-01", request.getDateRanges().get(0).getStartDate());
        assertEquals("2020-01-31", request.getDateRanges().get(0).getEndDate());
        assertEquals(1, request.getDimensionFilterClauses().size());
        assertEquals("ga:eventCategory",
                request.getDimensionFilterClauses().get(0).getFilters().get(0).getDimensionName());
    }

    @Test
    public void testEmptyReport() throws Exception {
        Report empty = new Report()
                .setColumnHeader(new ColumnHeader().setDimensions(RESULTS.getDimensionIds()))
                .setData(new ReportData());
        when(client.batchGet(any(GetReportsRequest.class)))
                .thenReturn(new GetReportsResponse().setReports(ImmutableList.of(empty)));

        assertTrue(fetcher.fetch(RESULTS, DATES, Optional.<String>empty()).isEmpty());
    }

    @Test
    public void testRetriesThenSucceeds() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class)))
                .thenThrow(new SocketTimeoutException("Read timed out"))
                .thenThrow(httpError(503))
                .thenReturn(response(null, ImmutableList.of("u1", "click")));

        List<Row> rows = fetcher.fetch(RESULTS, DATES, Optional.<String>empty());

        assertEquals(1, rows.size());
        verify(client, times(3)).batchGet(any(GetReportsRequest.class));
    }

    @Test
    public void testGivesUpAfterRetries() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenThrow(new IOException("IO BOOM!"));

        try {
            fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
            fail("Expected a FetchException once the tries ran out");
        } catch (FetchException e) {
            assertEquals(RESULTS, e.getBatchSpec());
            assertTrue(e.getCause() instanceof IOException);
        }
        verify(client, times(3)).batchGet(any(GetReportsRequest.class));
    }

    @Test
    public void testBadRequestIsNotRetried() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenThrow(httpError(400));

        try {
            fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
            fail("Expected a FetchException");
        } catch (FetchException e) {
            assertEquals(RESULTS, e.getBatchSpec());
        }
        verify(client, times(1)).batchGet(any(GetReportsRequest.class));
    }

    @Test
    public void testRetryable() {
        assertTrue(AnalyticsReportingFetcher.isRetryable(new IOException("Connection reset")));
        assertTrue(AnalyticsReportingFetcher.isRetryable(httpError(429)));
        assertTrue(AnalyticsReportingFetcher.isRetryable(httpError(500)));
        assertTrue(AnalyticsReportingFetcher.isRetryable(httpError(503)));
        assertFalse(AnalyticsReportingFetcher.isRetryable(httpError(400)));
        assertFalse(AnalyticsReportingFetcher.isRetryable(httpError(401)));
        assertFalse(AnalyticsReportingFetcher.isRetryable(httpError(403)));
    }

    @Test
    public void testStripNonAscii() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class)))
                .thenReturn(response(null, ImmutableList.of("u1", "Zürich ✓")));

        List<Row> stripped = fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
        assertEquals("Zrich ", stripped.get(0).get("ga:eventCategory"));

        AnalyticsReportingFetcher keepAll = new AnalyticsReportingFetcher(client, "123456", 2, false, NO_SLEEP);
        List<Row> kept = keepAll.fetch(RESULTS, DATES, Optional.<String>empty());
        assertEquals("Zürich ✓", kept.get(0).get("ga:eventCategory"));
    }

    @Test(expected = FetchException.class)
    public void testShortRow() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenReturn(response(null, ImmutableList.of("u1")));
        fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
    }

    @Test(expected = FetchException.class)
    public void testWrongColumns() throws Exception {
        Report report = new Report()
                .setColumnHeader(new ColumnHeader().setDimensions(ImmutableList.of("ga:eventCategory", "ga:dimension1")))
                .setData(new ReportData());
        when(client.batchGet(any(GetReportsRequest.class)))
                .thenReturn(new GetReportsResponse().setReports(ImmutableList.of(report)));
        fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
    }

    @Test(expected = FetchException.class)
    public void testNoReport() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenReturn(new GetReportsResponse());
        fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
    }

    @Test(expected = FetchException.class)
    public void testRepeatedPageToken() throws Exception {
        when(client.batchGet(any(GetReportsRequest.class))).thenReturn(
                response("2", ImmutableList.of("u1", "click")),
                response("2", ImmutableList.of("u1", "view")));
        fetcher.fetch(RESULTS, DATES, Optional.<String>empty());
    }

    @Test(expected = FetchException.class)
    public void testInvalidFilter() throws Exception {
        fetcher.fetch(RESULTS, DATES, Optional.of("eventCategory LIKE click"));
    }
}
