/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch.reporting;

import com.google.api.client.googleapis.auth.oauth2.GoogleCredential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.services.analyticsreporting.v4.AnalyticsReporting;
import com.google.api.services.analyticsreporting.v4.model.GetReportsRequest;
import com.google.api.services.analyticsreporting.v4.model.GetReportsResponse;
import com.urbanairship.dimstitch.ConfigException;
import com.urbanairship.dimstitch.config.DownloadConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.Collection;

/**
 * A {@link ReportsClient} backed by the Google Analytics Reporting API v4 client library, authorized
 * as a service account.
 */
public class GoogleReportsClient implements ReportsClient {
    private static final Logger log = LoggerFactory.getLogger(GoogleReportsClient.class);

    public static final String APPLICATION_NAME = "dimension-stitch";

    private static final int CONNECT_TIMEOUT_MILLIS = 30 * 1000;
    private static final int READ_TIMEOUT_MILLIS = 5 * 60 * 1000;

    private final AnalyticsReporting analyticsReporting;

    public GoogleReportsClient(AnalyticsReporting analyticsReporting) {
        this.analyticsReporting = analyticsReporting;
    }

    /**
     * Load the service account key and build an authorized client. The key file may be a .p12 key
     * together with the service account email, or a .json key which carries its own email.
     *
     * @throws ConfigException if the key can't be read or the transport can't be set up
     */
    public static GoogleReportsClient create(DownloadConfiguration config) throws ConfigException {
        try {
            HttpTransport transport = GoogleNetHttpTransport.newTrustedTransport();
            JsonFactory jsonFactory = JacksonFactory.getDefaultInstance();
            GoogleCredential credential = loadCredential(config, transport, jsonFactory);

            AnalyticsReporting.Builder builder = new AnalyticsReporting.Builder(transport, jsonFactory,
                    withTimeouts(credential))
                    .setApplicationName(APPLICATION_NAME);
            if (config.rootUrl != null) {
                builder.setRootUrl(config.rootUrl);
            }
            log.debug("Built reporting client for view " + config.viewId + " as " + config.serviceAccountEmail);
            return new GoogleReportsClient(builder.build());
        } catch (FileNotFoundException e) {
            throw new ConfigException("Key file not found: " + config.keyFileLocation, e);
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigException("Unable to build Google Analytics authorization: " + e.getMessage(), e);
        }
    }

    private static GoogleCredential loadCredential(DownloadConfiguration config, HttpTransport transport,
                                                   JsonFactory jsonFactory)
            throws IOException, GeneralSecurityException {
        Collection<String> scopes = config.scopes;
        File keyFile = new File(config.keyFileLocation);
        if (config.keyFileLocation.endsWith(".json")) {
            try (InputStream in = new FileInputStream(keyFile)) {
                return GoogleCredential.fromStream(in, transport, jsonFactory).createScoped(scopes);
            }
        }
        if (!keyFile.isFile()) {
            throw new FileNotFoundException(config.keyFileLocation);
        }
        return new GoogleCredential.Builder()
                .setTransport(transport)
                .setJsonFactory(jsonFactory)
                .setServiceAccountId(config.serviceAccountEmail)
                .setServiceAccountPrivateKeyFromP12File(keyFile)
                .setServiceAccountScopes(scopes)
                .build();
    }

    private static HttpRequestInitializer withTimeouts(final GoogleCredential credential) {
        return new HttpRequestInitializer() {
            @Override
            public void initialize(HttpRequest request) throws IOException {
                credential.initialize(request);
                request.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
                request.setReadTimeout(READ_TIMEOUT_MILLIS);
            }
        };
    }

    @Override
    public GetReportsResponse batchGet(GetReportsRequest request) throws IOException {
        return analyticsReporting.reports().batchGet(request).execute();
    }
}
