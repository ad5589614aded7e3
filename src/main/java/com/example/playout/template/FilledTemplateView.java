package com.example.playout.template;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response shapes of the template endpoints, in the template file's field naming.
 */
public final class FilledTemplateView {

    private FilledTemplateView() {
    }

    public record Template(
            @JsonProperty("type") String type,
            @JsonProperty("days") int days,
            @JsonProperty("total_seconds") double totalSeconds,
            @JsonProperty("items") List<Item> items) {
    }

    public record Item(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("file_path") String filePath,
            @JsonProperty("duration_seconds") double durationSeconds,
            @JsonProperty("start_offset") Double startOffset,
            @JsonProperty("end_offset") Double endOffset,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime,
            @JsonProperty("duration_category") String durationCategory,
            @JsonProperty("is_fixed_time") boolean fixedTime,
            @JsonProperty("is_gap") boolean gapMarker,
            @JsonProperty("content_type") String contentType,
            @JsonProperty("guid") String guid) {
    }

    public record GapView(
            @JsonProperty("start") double start,
            @JsonProperty("end") double end,
            @JsonProperty("duration") double duration,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime) {
    }

    public record Report(
            @JsonProperty("status") String status,
            @JsonProperty("items_added") int itemsAdded,
            @JsonProperty("seconds_filled") double secondsFilled,
            @JsonProperty("trimmed_placements") int trimmedPlacements,
            @JsonProperty("iterations") int iterations,
            @JsonProperty("iteration_limit_reached") boolean iterationLimitReached,
            @JsonProperty("remaining_seconds") double remainingSeconds,
            @JsonProperty("remaining_gaps") List<GapView> remainingGaps,
            @JsonProperty("category_counts") Map<String, Integer> categoryCounts) {
    }

    public record FillResponse(
            @JsonProperty("template") Template template,
            @JsonProperty("report") Report report) {
    }

    public record GapPreview(
            @JsonProperty("type") String type,
            @JsonProperty("total_seconds") double totalSeconds,
            @JsonProperty("open_seconds") double openSeconds,
            @JsonProperty("gaps") List<GapView> gaps) {
    }
}
