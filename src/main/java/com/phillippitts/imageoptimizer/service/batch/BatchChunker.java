package com.phillippitts.imageoptimizer.service.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits task lists into contiguous, order-preserving batches no larger than a fixed size.
 *
 * <p>For {@code N} items and limit {@code M} the result has {@code ceil(N / M)} batches; every
 * batch has {@code M} items except possibly the last. An empty input yields no batches.
 */
public final class BatchChunker {

    private BatchChunker() {
        // Utility class - prevent instantiation
    }

    /**
     * @param items        items to split (not modified)
     * @param maxBatchSize largest batch size, at least 1
     * @param <T>          item type
     * @return unmodifiable list of unmodifiable batches in input order
     * @throws IllegalArgumentException if {@code maxBatchSize < 1}
     */
    public static <T> List<List<T>> chunk(List<T> items, int maxBatchSize) {
        Objects.requireNonNull(items, "items");
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got: " + maxBatchSize);
        }
        int size = items.size();
        List<List<T>> batches = new ArrayList<>((size + maxBatchSize - 1) / maxBatchSize);
        for (int from = 0; from < size; from += maxBatchSize) {
            int to = Math.min(from + maxBatchSize, size);
            batches.add(List.copyOf(items.subList(from, to)));
        }
        return List.copyOf(batches);
    }
}
