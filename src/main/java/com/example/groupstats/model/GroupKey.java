package com.example.groupstats.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Composite identifier that partitions aggregation, e.g. a hospital and a diagnosis.
 *
 * <p>Equality is exact string equality. No case or whitespace normalization is
 * applied; callers supply values that are already normalized.
 *
 * <p>Keys order by {@code first}, then {@code second}, using natural string order.
 */
public record GroupKey(
        String first,
        String second
) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::first)
            .thenComparing(GroupKey::second);

    public GroupKey {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
    }

    /**
     * Creates a key from its two parts.
     */
    public static GroupKey of(String first, String second) {
        return new GroupKey(first, second);
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }
}
