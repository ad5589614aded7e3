package com.example.playout.template;

import com.example.playout.fill.FillReport;
import com.example.playout.timeline.DurationCategory;
import com.example.playout.timeline.Gap;
import com.example.playout.timeline.ScheduleItem;
import com.example.playout.timeline.TimeFormat;
import com.example.playout.timeline.TimeModel;
import com.example.playout.timeline.Timeline;
import com.example.playout.timeline.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts template and catalog snapshots to engine values and back. Field-name variants of
 * the template format are resolved here and nowhere else.
 */
@Component
public class TemplateSnapshotMapper {

    private static final Logger logger = LoggerFactory.getLogger(TemplateSnapshotMapper.class);

    public Timeline toTimeline(TemplateSnapshot snapshot) {
        Topology topology = Topology.fromToken(snapshot.type());
        List<ScheduleItem> items = new ArrayList<>();
        for (TemplateItemPayload payload : snapshot.items()) {
            items.add(toItem(payload, topology));
        }
        Timeline timeline = new Timeline(topology, dayCount(topology, snapshot.days()), items);
        logger.debug("Mapped {} template with {} item(s), {} placed",
                topology.token(), items.size(), timeline.placedItems().size());
        return timeline;
    }

    public List<ScheduleItem> toCatalog(List<CatalogEntryPayload> entries) {
        List<ScheduleItem> catalog = new ArrayList<>();
        int unusable = 0;
        for (CatalogEntryPayload entry : entries) {
            ScheduleItem item = new ScheduleItem(
                    entry.id(),
                    firstNonBlank(entry.title(), entry.contentTitle(), entry.fileName()),
                    firstNonNull(entry.durationSeconds(), entry.fileDuration(), 0d),
                    DurationCategory.fromToken(entry.durationCategory()));
            item.setFilePath(entry.filePath());
            item.setEngagementScore(entry.engagementScore());
            item.setContentType(entry.contentType());
            item.setGuid(entry.guid());
            if (item.getDurationSeconds() <= 0) {
                unusable++;
            }
            catalog.add(item);
        }
        if (unusable > 0) {
            logger.warn("{} catalog entr(ies) without a positive duration will never be selected", unusable);
        }
        return catalog;
    }

    public FilledTemplateView.Template toView(Timeline timeline) {
        List<FilledTemplateView.Item> items = timeline.getItems().stream()
                .map(i -> new FilledTemplateView.Item(
                        i.getId(), i.getTitle(), i.getFilePath(), i.getDurationSeconds(),
                        i.getStartOffset(), i.getEndOffset(), i.getStartTime(), i.getEndTime(),
                        i.getDurationCategory() == null ? null : i.getDurationCategory().token(),
                        i.isFixedTime(), i.isGapMarker(), i.getContentType(), i.getGuid()))
                .toList();
        return new FilledTemplateView.Template(timeline.getTopology().token(), timeline.getDayCount(),
                timeline.getTotalSeconds(), items);
    }

    public FilledTemplateView.Report toView(FillReport report, Timeline timeline) {
        return new FilledTemplateView.Report(
                report.status().name(),
                report.itemsAdded(),
                report.secondsFilled(),
                report.trimmedPlacements(),
                report.iterations(),
                report.iterationLimitReached(),
                report.remainingSeconds(),
                toGapViews(report.remainingGaps(), timeline),
                report.categoryCounts());
    }

    public List<FilledTemplateView.GapView> toGapViews(List<Gap> gaps, Timeline timeline) {
        TimeFormat format = TimeModel.detectFormat(
                timeline.getItems().stream().map(ScheduleItem::getStartTime).toList());
        return gaps.stream()
                .map(g -> new FilledTemplateView.GapView(
                        g.startOffset(), g.endOffset(), g.duration(),
                        TimeModel.fromOffset(g.startOffset(), timeline.getTopology(), format),
                        TimeModel.fromEndOffset(g.endOffset(), timeline.getTopology(), format)))
                .toList();
    }

    private ScheduleItem toItem(TemplateItemPayload payload, Topology topology) {
        ScheduleItem item = new ScheduleItem(
                firstNonBlank(payload.id(), payload.assetId(), payload.contentId()),
                firstNonBlank(payload.title(), payload.contentTitle(), payload.fileName()),
                firstNonNull(payload.durationSeconds(), payload.fileDuration(), 0d),
                DurationCategory.fromToken(payload.durationCategory()));
        item.setFilePath(payload.filePath());
        item.setContentType(payload.contentType());
        item.setGuid(payload.guid());
        item.setFixedTime(Boolean.TRUE.equals(payload.fixedTime()) || Boolean.TRUE.equals(payload.liveInput()));
        item.setGapMarker(Boolean.TRUE.equals(payload.gapMarker()));
        if (payload.startOffset() != null) {
            item.setStartOffset(payload.startOffset());
        } else if (payload.startTime() != null && !payload.startTime().isBlank()) {
            item.setStartOffset(TimeModel.toOffset(payload.startTime(), topology));
            item.setStartTime(payload.startTime());
        }
        return item;
    }

    private static int dayCount(Topology topology, Integer days) {
        if (topology == Topology.MONTHLY && days != null) {
            return days;
        }
        return topology.getDefaultDays();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static double firstNonNull(Double first, Double second, double fallback) {
        if (first != null) return first;
        if (second != null) return second;
        return fallback;
    }
}
