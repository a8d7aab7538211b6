package com.example.groupstats.aggregation;

import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Aggregates the items of an Iterable into a result.
 *
 * <p>This is the Iterator-based counterpart of {@link java.util.stream.Collector},
 * meant for sequential processing. Aggregation runs in three phases:
 * <ol>
 *   <li><b>Initialization:</b> create a mutable accumulator via {@link #supplier()}</li>
 *   <li><b>Accumulation:</b> fold each item in via {@link #accumulator()}</li>
 *   <li><b>Finishing:</b> turn the accumulator into the result via {@link #finisher()}</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>{@code
 * Aggregator<Row, ?, Map<GroupKey, PartialAggregate>> aggregator = new PartialAggregator();
 * Map<GroupKey, PartialAggregate> partials = aggregator.aggregate(chunk.rows());
 * }</pre>
 *
 * @param <T> the type of input elements
 * @param <A> the mutable accumulator type
 * @param <R> the result type of the aggregation
 */
public interface Aggregator<T, A, R> {

    /**
     * Creates a new mutable accumulator instance.
     * Called once at the start of aggregation.
     *
     * @return a supplier that creates a new accumulator
     */
    Supplier<A> supplier();

    /**
     * Incorporates a single element into the accumulator.
     * Called once per element, in encounter order.
     *
     * @return a function that adds an element to an accumulator
     */
    BiConsumer<A, T> accumulator();

    /**
     * Transforms the accumulator into the final result.
     * Called once after all elements are processed.
     *
     * @return a function that transforms the accumulator into the result
     */
    Function<A, R> finisher();

    /**
     * Aggregates all items from the given Iterable into a single result.
     *
     * @param source the iterable to aggregate
     * @return the aggregation result
     */
    default R aggregate(Iterable<? extends T> source) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            accFn.accept(acc, item);
        }
        return finisher().apply(acc);
    }
}
