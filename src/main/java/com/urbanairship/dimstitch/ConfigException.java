/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

/**
 * Thrown when the download configuration breaks one of the rules the reporting API imposes on
 * requests, for example a batch with more than seven dimensions or a user group and results group
 * that don't start with the same dimension. Always thrown before any request is made.
 */
public class ConfigException extends Exception {
    private static final long serialVersionUID = 1L;

    public ConfigException(String msg) {
        super(msg);
    }

    public ConfigException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
