package com.urbanairship.dimstitch.reporting;

import org.apache.commons.lang.math.RandomUtils;

/**
 * Decides whether and how long to wait before trying a failed report request again.
 */
public interface RetryPolicy {
    /**
     * blocks until an appropriate duration has elapsed
     *
     * @param attempt the try number that just failed, starting at 0. A constant or random jittered retry
     *                policy would ignore this parameter. A linear backoff waits longer for each attempt.
     *
     * @return false if we have exhausted our retries, true otherwise.
     *
     * @throws InterruptedException
     */
    boolean sleep(int attempt) throws InterruptedException;

    /**
     * Waits a little longer after each failure, with 10% jitter either way so parallel batches that fail
     * together don't all retry together.
     */
    class Jittered implements RetryPolicy {
        private static final long SLEEP_INTERVAL_MILLIS = 1000;
        private static final long MAX_SLEEP_MILLIS = 1000 * 60;

        private final int numTries;

        public Jittered(int numTries) {
            this.numTries = numTries;
        }

        @Override
        public boolean sleep(int attempt) throws InterruptedException {
            if (attempt + 1 >= numTries) {
                return false;
            }
            Thread.sleep(jitteredRetryMillis(attempt));
            return true;
        }

        static long jitteredRetryMillis(int attempt) {
            double jitter = 0.9 + (1.1 - 0.9) * RandomUtils.nextDouble();
            long retryMillis = SLEEP_INTERVAL_MILLIS * (attempt + 1);
            return Math.min(Math.round(retryMillis * jitter), MAX_SLEEP_MILLIS);
        }
    }
}
