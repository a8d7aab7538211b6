package com.example.groupstats.model;

import java.util.Objects;

/**
 * One decoded input record: the group it belongs to, a numeric measure that is
 * averaged, and a categorical measure whose most frequent value is reported.
 */
public record Row(
        GroupKey group,
        double numericMeasure,
        String categoricalMeasure
) {
    public Row {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(categoricalMeasure, "categoricalMeasure must not be null");
    }

    /**
     * Shorthand used heavily by tests and fixtures.
     */
    public static Row of(String first, String second, String category, double measure) {
        return new Row(new GroupKey(first, second), measure, category);
    }
}
