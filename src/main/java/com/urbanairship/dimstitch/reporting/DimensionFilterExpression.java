/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch.reporting;

import com.google.api.services.analyticsreporting.v4.model.DimensionFilter;
import com.google.api.services.analyticsreporting.v4.model.DimensionFilterClause;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A command line filter such as {@code "ga:dimension1 BEGINS_WITH 0123 AND ga:browser EXACT Firefox"},
 * parsed into the dimension filter clause of a report request.
 * <p>
 * The terms are joined by AND or by OR, never a mix of both. The expression of a term is everything
 * after the operator, so it may contain spaces.
 */
public class DimensionFilterExpression {
    public static final Set<String> OPERATORS = ImmutableSet.of(
            "REGEXP", "BEGINS_WITH", "ENDS_WITH", "PARTIAL", "EXACT");

    private static final String AND = "AND";
    private static final String OR = "OR";

    private static final Pattern TERM = Pattern.compile(
            "^\\s*(ga:\\w+)\\s+(" + Joiner.on('|').join(OPERATORS) + ")\\s+(.*\\S)\\s*$");

    private final String logicalOperator;
    private final List<DimensionFilter> filters;

    private DimensionFilterExpression(String logicalOperator, List<DimensionFilter> filters) {
        this.logicalOperator = logicalOperator;
        this.filters = filters;
    }

    /**
     * @throws IllegalArgumentException if the filter doesn't follow the
     *                                  {@code ga:name OPERATOR expression [AND|OR ...]} format
     */
    public static DimensionFilterExpression parse(String filter) {
        if (filter == null || filter.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty filter");
        }

        boolean hasAnd = filter.contains(" " + AND + " ");
        boolean hasOr = filter.contains(" " + OR + " ");
        if (hasAnd && hasOr) {
            throw new IllegalArgumentException("Invalid filter, can't mix AND with OR: " + filter);
        }
        String logicalOperator = hasAnd ? AND : hasOr ? OR : null;

        String[] terms = logicalOperator == null ? new String[] {filter} :
                filter.split(" " + logicalOperator + " ", -1);
        List<DimensionFilter> filters = new ArrayList<>(terms.length);
        for (String term : terms) {
            Matcher matcher = TERM.matcher(term);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid filter arguments: " + filter +
                        ", expected ga:name OPERATOR expression with OPERATOR one of " + OPERATORS);
            }
            filters.add(new DimensionFilter()
                    .setDimensionName(matcher.group(1))
                    .setOperator(matcher.group(2))
                    .setExpressions(ImmutableList.of(matcher.group(3))));
        }
        return new DimensionFilterExpression(logicalOperator, ImmutableList.copyOf(filters));
    }

    /**
     * @return AND, OR, or null for a single term
     */
    public String getLogicalOperator() {
        return logicalOperator;
    }

    public List<DimensionFilter> getFilters() {
        return filters;
    }

    public DimensionFilterClause toClause() {
        DimensionFilterClause clause = new DimensionFilterClause().setFilters(new ArrayList<>(filters));
        if (logicalOperator != null) {
            clause.setOperator(logicalOperator);
        }
        return clause;
    }
}
