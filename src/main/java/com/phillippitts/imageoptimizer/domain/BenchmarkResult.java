package com.phillippitts.imageoptimizer.domain;

/**
 * Timing summary of a benchmark run.
 *
 * @param totalTimeMs            wall-clock duration of the run
 * @param avgPerImageMs          average milliseconds per image
 * @param throughputImagesPerSec images per second, infinite when the run took under 1 ms
 * @param imageCount             number of images processed
 * @param totalInputBytes        sum of input sizes
 * @param totalOutputBytes       sum of output sizes
 */
public record BenchmarkResult(
        long totalTimeMs,
        double avgPerImageMs,
        double throughputImagesPerSec,
        int imageCount,
        long totalInputBytes,
        long totalOutputBytes
) {

    public static BenchmarkResult from(long totalTimeMs, int imageCount,
                                       long totalInputBytes, long totalOutputBytes) {
        double avg = imageCount == 0 ? 0.0 : (double) totalTimeMs / imageCount;
        double throughput = totalTimeMs == 0
                ? Double.POSITIVE_INFINITY
                : imageCount / (totalTimeMs / 1000.0);
        return new BenchmarkResult(totalTimeMs, avg, throughput, imageCount, totalInputBytes, totalOutputBytes);
    }
}
