/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

/**
 * What a run does when a batch can't be fetched.
 *
 * FAIL_FAST: cancel the other fetches and abort the run without output. This is the default.
 *
 * BEST_EFFORT: skip the failed batch and stitch whatever was fetched, warning that the output is
 * incomplete. The base batch can't be skipped, without it there is nothing to stitch onto.
 */
public enum FetchFailurePolicy {FAIL_FAST, BEST_EFFORT}
