package com.example.playout.config;

import com.example.playout.common.ApiResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/config/scheduling")
public class SchedulingSettingsController {

    private final SchedulingSettingsService settingsService;
    private final FillEngineSettings engineSettings;

    public SchedulingSettingsController(SchedulingSettingsService settingsService, FillEngineSettings engineSettings) {
        this.settingsService = settingsService;
        this.engineSettings = engineSettings;
    }

    public record UpdateRequest(@NotEmpty(message = "rotation_order must contain at least one category")
                                @JsonProperty("rotation_order")
                                List<String> rotationOrder) {
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> get() {
        return ResponseEntity.ok(ApiResponse.success("Scheduling settings", describe(settingsService.rotationOrder())));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> update(@Valid @RequestBody UpdateRequest req) {
        SchedulingSettings saved = settingsService.updateRotationOrder(req.rotationOrder());
        return ResponseEntity.ok(ApiResponse.success("Scheduling settings updated", describe(saved.rotationTokens())));
    }

    private Map<String, Object> describe(List<String> rotation) {
        Map<String, Object> data = new HashMap<>();
        data.put("rotation_order", rotation);
        data.put("frame_rate", engineSettings.getFrameRate());
        data.put("large_gap_threshold_seconds", engineSettings.getLargeGapThresholdSeconds());
        data.put("max_iterations", engineSettings.getMaxIterations());
        data.put("per_day_gaps", engineSettings.isPerDayGaps());
        return data;
    }
}
