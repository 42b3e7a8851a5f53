/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch;

import org.joda.time.LocalDate;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The inclusive range of days a download covers. Each end is either an explicit date (YYYY-MM-DD) or
 * one of the relative dates the reporting API understands: "today", "yesterday" or "NdaysAgo". The
 * original strings are what is sent to the API; {@link #resolveStart(LocalDate)} and
 * {@link #resolveEnd(LocalDate)} turn them into calendar dates for checking and logging.
 */
public class DateRange {
    private static final Pattern EXPLICIT = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}$");
    private static final Pattern RELATIVE = Pattern.compile("^(today|yesterday|([0-9]+)daysAgo)$");
    private static final DateTimeFormatter DATE_FORMAT = ISODateTimeFormat.date();

    private final String startDate;
    private final String endDate;

    private DateRange(String startDate, String endDate) {
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * @param endDate may be null, in which case the range is the single start day
     * @throws IllegalArgumentException if either date isn't in a supported format, or the range ends
     *                                  before it starts
     */
    public static DateRange of(String startDate, String endDate) {
        if (!isValid(startDate)) {
            throw new IllegalArgumentException("invalid start date format: \"" + startDate + "\"");
        }
        if (endDate == null) {
            endDate = startDate;
        } else if (!isValid(endDate)) {
            throw new IllegalArgumentException("invalid end date format: \"" + endDate + "\"");
        }

        DateRange range = new DateRange(startDate, endDate);
        LocalDate today = LocalDate.now();
        if (range.resolveStart(today).isAfter(range.resolveEnd(today))) {
            throw new IllegalArgumentException("start date " + startDate + " is after end date " + endDate);
        }
        return range;
    }

    public static DateRange of(String day) {
        return of(day, null);
    }

    public static boolean isValid(String date) {
        if (date == null) {
            return false;
        }
        if (RELATIVE.matcher(date).matches()) {
            return true;
        }
        if (!EXPLICIT.matcher(date).matches()) {
            return false;
        }
        try {
            DATE_FORMAT.parseLocalDate(date);
            return true;
        } catch (IllegalArgumentException e) {
            // Right shape but not a real day, like 2020-02-31
            return false;
        }
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public LocalDate resolveStart(LocalDate today) {
        return resolve(startDate, today);
    }

    public LocalDate resolveEnd(LocalDate today) {
        return resolve(endDate, today);
    }

    private static LocalDate resolve(String date, LocalDate today) {
        Matcher relative = RELATIVE.matcher(date);
        if (!relative.matches()) {
            return DATE_FORMAT.parseLocalDate(date);
        }
        if (date.equals("today")) {
            return today;
        } else if (date.equals("yesterday")) {
            return today.minusDays(1);
        } else {
            return today.minusDays(Integer.parseInt(relative.group(2)));
        }
    }

    public String toString() {
        return startDate + " to " + endDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRange)) return false;
        DateRange other = (DateRange) o;
        return startDate.equals(other.startDate) && endDate.equals(other.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, endDate);
    }
}
