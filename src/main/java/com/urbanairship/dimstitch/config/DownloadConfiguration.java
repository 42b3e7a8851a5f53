package com.urbanairship.dimstitch.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.urbanairship.dimstitch.DimensionSchema;
import com.urbanairship.dimstitch.FetchFailurePolicy;
import com.urbanairship.dimstitch.JoinPolicy;

import java.util.List;

/**
 * Everything a download needs to know, built once at startup and passed to whatever needs it.
 */
public class DownloadConfiguration {
    /**
     * Which dimensions to download and how to group them into requests
     */
    public final DimensionSchema schema;

    /**
     * The service account the reporting API is called as
     */
    public final String serviceAccountEmail;

    /**
     * Private key of the service account, either a .p12 file or a .json key file
     */
    public final String keyFileLocation;

    /**
     * The reporting view to download from
     */
    public final String viewId;

    public final List<String> scopes;
    public static final String DEFAULT_SCOPE = "https://www.googleapis.com/auth/analytics.readonly";

    /**
     * Root URL of the reporting service, null for the library default
     */
    public final String rootUrl;

    /**
     * Page size of report requests
     */
    public final int maxResults;
    public static final int DEFAULT_MAX_RESULTS = 10000;

    /**
     * Written in place of a value that a batch had no row for, under {@link JoinPolicy#LEFT}
     */
    public final String invalidValue;
    public static final String DEFAULT_INVALID_VALUE = "";

    /**
     * Whether to remove non-ASCII characters from values as they are fetched
     */
    public final boolean stripNonAscii;

    /**
     * The number of batches fetched at the same time
     */
    public final int fetchThreads;
    public static final int DEFAULT_FETCH_THREADS = 4;

    /**
     * How many times a failed report request is tried before the batch fails
     */
    public final int numTries;
    public static final int DEFAULT_NUM_TRIES = 3;

    public final JoinPolicy joinPolicy;
    public final FetchFailurePolicy fetchFailurePolicy;

    private DownloadConfiguration(Builder builder) {
        schema = Preconditions.checkNotNull(builder.schema, "schema");
        serviceAccountEmail = builder.serviceAccountEmail;
        keyFileLocation = builder.keyFileLocation;
        viewId = builder.viewId;
        scopes = ImmutableList.copyOf(builder.scopes);
        rootUrl = builder.rootUrl;
        maxResults = builder.maxResults;
        invalidValue = Preconditions.checkNotNull(builder.invalidValue, "invalidValue");
        stripNonAscii = builder.stripNonAscii;
        fetchThreads = builder.fetchThreads;
        numTries = builder.numTries;
        joinPolicy = Preconditions.checkNotNull(builder.joinPolicy, "joinPolicy");
        fetchFailurePolicy = Preconditions.checkNotNull(builder.fetchFailurePolicy, "fetchFailurePolicy");
        Preconditions.checkArgument(maxResults > 0, "maxResults must be positive");
        Preconditions.checkArgument(fetchThreads > 0, "fetchThreads must be positive");
        Preconditions.checkArgument(numTries > 0, "numTries must be positive");
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * A builder starting out with all the settings of an existing configuration, for overriding a few.
     */
    public static Builder newBuilder(DownloadConfiguration from) {
        return new Builder()
                .setSchema(from.schema)
                .setServiceAccountEmail(from.serviceAccountEmail)
                .setKeyFileLocation(from.keyFileLocation)
                .setViewId(from.viewId)
                .setScopes(from.scopes)
                .setRootUrl(from.rootUrl)
                .setMaxResults(from.maxResults)
                .setInvalidValue(from.invalidValue)
                .setStripNonAscii(from.stripNonAscii)
                .setFetchThreads(from.fetchThreads)
                .setNumTries(from.numTries)
                .setJoinPolicy(from.joinPolicy)
                .setFetchFailurePolicy(from.fetchFailurePolicy);
    }

    public static final class Builder {
        private DimensionSchema schema;
        private String serviceAccountEmail;
        private String keyFileLocation;
        private String viewId;
        private List<String> scopes = ImmutableList.of(DEFAULT_SCOPE);
        private String rootUrl;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private String invalidValue = DEFAULT_INVALID_VALUE;
        private boolean stripNonAscii = true;
        private int fetchThreads = DEFAULT_FETCH_THREADS;
        private int numTries = DEFAULT_NUM_TRIES;
        private JoinPolicy joinPolicy = JoinPolicy.INNER;
        private FetchFailurePolicy fetchFailurePolicy = FetchFailurePolicy.FAIL_FAST;

        private Builder() {
        }

        public Builder setSchema(DimensionSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder setServiceAccountEmail(String serviceAccountEmail) {
            this.serviceAccountEmail = serviceAccountEmail;
            return this;
        }

        public Builder setKeyFileLocation(String keyFileLocation) {
            this.keyFileLocation = keyFileLocation;
            return this;
        }

        public Builder setViewId(String viewId) {
            this.viewId = viewId;
            return this;
        }

        public Builder setScopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder setRootUrl(String rootUrl) {
            this.rootUrl = rootUrl;
            return this;
        }

        public Builder setMaxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder setInvalidValue(String invalidValue) {
            this.invalidValue = invalidValue;
            return this;
        }

        public Builder setStripNonAscii(boolean stripNonAscii) {
            this.stripNonAscii = stripNonAscii;
            return this;
        }

        public Builder setFetchThreads(int fetchThreads) {
            this.fetchThreads = fetchThreads;
            return this;
        }

        public Builder setNumTries(int numTries) {
            this.numTries = numTries;
            return this;
        }

        public Builder setJoinPolicy(JoinPolicy joinPolicy) {
            this.joinPolicy = joinPolicy;
            return this;
        }

        public Builder setFetchFailurePolicy(FetchFailurePolicy fetchFailurePolicy) {
            this.fetchFailurePolicy = fetchFailurePolicy;
            return this;
        }

        public DownloadConfiguration build() {
            return new DownloadConfiguration(this);
        }
    }
}
