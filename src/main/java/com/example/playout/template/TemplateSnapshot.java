package com.example.playout.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * @param type  daily, weekly or monthly; daily when absent
 * @param days  day count of a monthly template; ignored for the other types
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateSnapshot(
        @JsonProperty("type") String type,
        @JsonProperty("days") @Min(value = 28, message = "a month has at least 28 days")
        @Max(value = 31, message = "a month has at most 31 days") Integer days,
        @JsonProperty("items") List<TemplateItemPayload> items) {

    public TemplateSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
