package com.example.playout.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of a fill or gap preview call. The rotation order and engine settings fall back to
 * the stored scheduling settings and {@code playout.fill.*} properties when omitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FillTemplateRequest(
        @JsonProperty("template") @NotNull(message = "template is required") @Valid TemplateSnapshot template,
        @JsonProperty("available_content") List<CatalogEntryPayload> availableContent,
        @JsonProperty("rotation_order") List<String> rotationOrder,
        @JsonProperty("per_day_gaps") Boolean perDayGaps,
        @JsonProperty("max_iterations") @Min(value = 1, message = "max_iterations must be positive") Integer maxIterations) {

    public FillTemplateRequest {
        availableContent = availableContent == null ? List.of() : List.copyOf(availableContent);
    }
}
