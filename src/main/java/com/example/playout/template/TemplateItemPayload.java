package com.example.playout.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One item of a template file as the template loader hands it over. Several historical
 * field names are accepted; {@link TemplateSnapshotMapper} picks the first one present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateItemPayload(
        @JsonProperty("id") String id,
        @JsonProperty("asset_id") String assetId,
        @JsonProperty("content_id") String contentId,
        @JsonProperty("title") String title,
        @JsonProperty("content_title") String contentTitle,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("duration_seconds") Double durationSeconds,
        @JsonProperty("file_duration") Double fileDuration,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("start_offset") Double startOffset,
        @JsonProperty("duration_category") String durationCategory,
        @JsonProperty("is_fixed_time") Boolean fixedTime,
        @JsonProperty("is_live_input") Boolean liveInput,
        @JsonProperty("is_gap") Boolean gapMarker,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("guid") String guid) {
}
