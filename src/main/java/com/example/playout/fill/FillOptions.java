package com.example.playout.fill;

import com.example.playout.timeline.TimeModel;

/**
 * Engine tuning for one fill call.
 *
 * @param frameRate                 rate of the frame guard left after every placement; non-positive disables it
 * @param largeGapThresholdSeconds  gaps above this may take content that does not fit
 * @param maxIterations             selection attempts before the fill stops with a partial result
 * @param perDayGaps                split gaps at day boundaries
 */
public record FillOptions(double frameRate, double largeGapThresholdSeconds, int maxIterations, boolean perDayGaps) {

    public static final double DEFAULT_LARGE_GAP_THRESHOLD = 300d;
    public static final int DEFAULT_MAX_ITERATIONS = 20_000;

    public FillOptions {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (largeGapThresholdSeconds < 0) {
            throw new IllegalArgumentException("largeGapThresholdSeconds must not be negative");
        }
    }

    public static FillOptions defaults() {
        return new FillOptions(TimeModel.DEFAULT_FRAME_RATE, DEFAULT_LARGE_GAP_THRESHOLD, DEFAULT_MAX_ITERATIONS, false);
    }

    public FillOptions withMaxIterations(int value) {
        return new FillOptions(frameRate, largeGapThresholdSeconds, value, perDayGaps);
    }

    public FillOptions withPerDayGaps(boolean value) {
        return new FillOptions(frameRate, largeGapThresholdSeconds, maxIterations, value);
    }
}
