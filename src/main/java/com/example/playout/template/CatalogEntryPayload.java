package com.example.playout.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogEntryPayload(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("content_title") String contentTitle,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("duration_seconds") Double durationSeconds,
        @JsonProperty("file_duration") Double fileDuration,
        @JsonProperty("duration_category") String durationCategory,
        @JsonProperty("engagement_score") Double engagementScore,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("guid") String guid) {
}
