/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A single reporting dimension, for example "ga:dimension1" or "ga:eventCategory". The identifier
 * is the name the reporting API knows the dimension by; the label is the human readable name that
 * appears in output headers.
 */
public class Dimension {
    public static final String API_PREFIX = "ga:";

    private final String id;
    private final String label;

    /**
     * @param id    API-native identifier. A bare name such as "dimension1" is given the
     *              {@link #API_PREFIX}.
     * @param label display label. If null, the identifier is used.
     */
    public Dimension(String id, String label) {
        Preconditions.checkArgument(id != null && !id.isEmpty(), "Dimension identifier may not be empty");
        this.id = qualify(id);
        this.label = label == null ? this.id : label;
    }

    public Dimension(String id) {
        this(id, null);
    }

    /**
     * Add the API prefix to a bare dimension name, leaving qualified names alone.
     */
    public static String qualify(String name) {
        return name.startsWith(API_PREFIX) ? name : API_PREFIX + name;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasTranslation() {
        return !label.equals(id);
    }

    public String toString() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimension)) return false;
        Dimension other = (Dimension) o;
        return id.equals(other.id) && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }
}
