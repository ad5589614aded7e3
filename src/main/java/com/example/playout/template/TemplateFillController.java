package com.example.playout.template;

import com.example.playout.common.ApiResponse;
import com.example.playout.common.error.ErrorLogBuffer;
import com.example.playout.fill.FillStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/templates")
public class TemplateFillController {

    private static final Logger logger = LoggerFactory.getLogger(TemplateFillController.class);

    private final TemplateFillService fillService;
    private final ErrorLogBuffer errorLogBuffer;

    public TemplateFillController(TemplateFillService fillService, ErrorLogBuffer errorLogBuffer) {
        this.fillService = fillService;
        this.errorLogBuffer = errorLogBuffer;
    }

    @PostMapping("/fill")
    public ResponseEntity<ApiResponse<FilledTemplateView.FillResponse>> fill(@Valid @RequestBody FillTemplateRequest request) {
        FilledTemplateView.FillResponse response = fillService.fill(request);
        FilledTemplateView.Report report = response.report();
        Map<String, Object> meta = new HashMap<>();
        meta.put("items_added", report.itemsAdded());
        meta.put("remaining_gaps", report.remainingGaps().size());
        String message = FillStatus.COMPLETE.name().equals(report.status())
                ? "Template filled"
                : String.format("Template partially filled: %d gap(s) remain open", report.remainingGaps().size());
        logger.info("{} ({} item(s) added)", message, report.itemsAdded());
        return ResponseEntity.ok(ApiResponse.success(message, response, meta));
    }

    @PostMapping("/gaps")
    public ResponseEntity<ApiResponse<FilledTemplateView.GapPreview>> gaps(@Valid @RequestBody FillTemplateRequest request) {
        FilledTemplateView.GapPreview preview = fillService.previewGaps(request);
        return ResponseEntity.ok(ApiResponse.success("Open time calculated", preview));
    }

    @GetMapping("/fill/errors")
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> recentErrors() {
        return ResponseEntity.ok(ApiResponse.success("Recent fill errors", errorLogBuffer.recent()));
    }

    @DeleteMapping("/fill/errors")
    public ResponseEntity<ApiResponse<Void>> clearErrors() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("Fill error log cleared", null));
    }
}
