package com.urbanairship.dimstitch.reporting;

import com.google.api.services.analyticsreporting.v4.model.GetReportsRequest;
import com.google.api.services.analyticsreporting.v4.model.GetReportsResponse;

import java.io.IOException;

/**
 * The one call {@link AnalyticsReportingFetcher} makes against the reporting service.
 */
public interface ReportsClient {
    GetReportsResponse batchGet(GetReportsRequest request) throws IOException;
}
