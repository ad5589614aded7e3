package com.example.playout.template;

import com.example.playout.common.error.ErrorLogBuffer;
import com.example.playout.config.FillEngineSettings;
import com.example.playout.config.SchedulingSettingsService;
import com.example.playout.exception.ScheduleFillException;
import com.example.playout.fill.FillOptions;
import com.example.playout.fill.FillResult;
import com.example.playout.fill.RotationConfig;
import com.example.playout.fill.ScheduleFiller;
import com.example.playout.timeline.Gap;
import com.example.playout.timeline.GapCalculator;
import com.example.playout.timeline.ScheduleItem;
import com.example.playout.timeline.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TemplateFillService {

    private static final Logger logger = LoggerFactory.getLogger(TemplateFillService.class);

    private final TemplateSnapshotMapper mapper;
    private final SchedulingSettingsService settingsService;
    private final FillEngineSettings engineSettings;
    private final ErrorLogBuffer errorLogBuffer;

    public TemplateFillService(TemplateSnapshotMapper mapper,
                               SchedulingSettingsService settingsService,
                               FillEngineSettings engineSettings,
                               ErrorLogBuffer errorLogBuffer) {
        this.mapper = mapper;
        this.settingsService = settingsService;
        this.engineSettings = engineSettings;
        this.errorLogBuffer = errorLogBuffer;
    }

    public FilledTemplateView.FillResponse fill(FillTemplateRequest request) {
        try {
            Timeline template = mapper.toTimeline(request.template());
            List<ScheduleItem> catalog = mapper.toCatalog(request.availableContent());
            RotationConfig rotation = resolveRotation(request.rotationOrder());
            FillOptions options = resolveOptions(request);

            FillResult result = new ScheduleFiller(options).fill(template, catalog, rotation);
            return new FilledTemplateView.FillResponse(
                    mapper.toView(result.timeline()),
                    mapper.toView(result.report(), result.timeline()));
        } catch (ScheduleFillException e) {
            errorLogBuffer.addError("fill " + templateType(request), e);
            throw e;
        }
    }

    public FilledTemplateView.GapPreview previewGaps(FillTemplateRequest request) {
        Timeline timeline = mapper.toTimeline(request.template());
        FillOptions options = resolveOptions(request);
        GapCalculator calculator = new GapCalculator(options.frameRate());
        List<Gap> gaps = options.perDayGaps()
                ? calculator.computeDailyGaps(timeline)
                : calculator.computeGaps(timeline);
        logger.info("Gap preview for {} template: {} gap(s)", timeline.getTopology().token(), gaps.size());
        return new FilledTemplateView.GapPreview(
                timeline.getTopology().token(),
                timeline.getTotalSeconds(),
                GapCalculator.totalSeconds(gaps),
                mapper.toGapViews(gaps, timeline));
    }

    private RotationConfig resolveRotation(List<String> override) {
        if (override != null && !override.isEmpty()) {
            return RotationConfig.fromTokens(override);
        }
        return RotationConfig.fromTokens(settingsService.rotationOrder());
    }

    private FillOptions resolveOptions(FillTemplateRequest request) {
        FillOptions options = engineSettings.toOptions();
        if (request.perDayGaps() != null) {
            options = options.withPerDayGaps(request.perDayGaps());
        }
        if (request.maxIterations() != null) {
            options = options.withMaxIterations(request.maxIterations());
        }
        return options;
    }

    private static String templateType(FillTemplateRequest request) {
        String type = request.template() == null ? null : request.template().type();
        return type == null ? "daily" : type;
    }
}
