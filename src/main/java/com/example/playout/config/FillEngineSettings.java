package com.example.playout.config;

import com.example.playout.fill.FillOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class FillEngineSettings {
    private final double frameRate;
    private final double largeGapThresholdSeconds;
    private final int maxIterations;
    private final boolean perDayGaps;

    public FillEngineSettings(
            @Value("${playout.fill.frame-rate:29.976}") double frameRate,
            @Value("${playout.fill.large-gap-threshold-seconds:300}") double largeGapThresholdSeconds,
            @Value("${playout.fill.max-iterations:20000}") int maxIterations,
            @Value("${playout.fill.per-day-gaps:false}") boolean perDayGaps) {
        this.frameRate = frameRate;
        this.largeGapThresholdSeconds = largeGapThresholdSeconds;
        this.maxIterations = maxIterations;
        this.perDayGaps = perDayGaps;
    }

    public double getFrameRate() { return frameRate; }
    public double getLargeGapThresholdSeconds() { return largeGapThresholdSeconds; }
    public int getMaxIterations() { return maxIterations; }
    public boolean isPerDayGaps() { return perDayGaps; }

    public FillOptions toOptions() {
        return new FillOptions(frameRate, largeGapThresholdSeconds, maxIterations, perDayGaps);
    }
}
