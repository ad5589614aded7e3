package com.example.playout.fill;

import com.example.playout.timeline.Gap;

import java.util.List;
import java.util.Map;

public record FillReport(FillStatus status,
                         int itemsAdded,
                         double secondsFilled,
                         int trimmedPlacements,
                         int iterations,
                         boolean iterationLimitReached,
                         List<Gap> remainingGaps,
                         Map<String, Integer> categoryCounts) {

    public FillReport {
        remainingGaps = remainingGaps == null ? List.of() : List.copyOf(remainingGaps);
        categoryCounts = categoryCounts == null ? Map.of() : Map.copyOf(categoryCounts);
    }

    public double remainingSeconds() {
        return remainingGaps.stream().mapToDouble(Gap::duration).sum();
    }
}
