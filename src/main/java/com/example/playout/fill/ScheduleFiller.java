package com.example.playout.fill;

import com.example.playout.exception.OverlapDetectedException;
import com.example.playout.timeline.Gap;
import com.example.playout.timeline.GapCalculator;
import com.example.playout.timeline.ScheduleItem;
import com.example.playout.timeline.TimeFormat;
import com.example.playout.timeline.TimeModel;
import com.example.playout.timeline.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills the open time of a template with catalog content.
 * <p>
 * Gaps are recomputed from scratch after every placement and content always goes to the start of
 * the earliest gap that has not been given up on. A gap is given up on once the selector has
 * nothing for it. The caller's timeline and catalog are copied, never modified.
 */
public class ScheduleFiller {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleFiller.class);

    enum State {
        IDLE,
        COMPUTING_GAPS,
        SELECTING_CONTENT,
        PLACING,
        DONE
    }

    private final FillOptions options;
    private final GapCalculator gapCalculator;
    private State state = State.IDLE;

    public ScheduleFiller() {
        this(FillOptions.defaults());
    }

    public ScheduleFiller(FillOptions options) {
        this.options = options;
        this.gapCalculator = new GapCalculator(options.frameRate());
    }

    public FillResult fill(Timeline template, List<ScheduleItem> catalog, RotationConfig rotation) {
        Timeline timeline = template.copy();
        List<ScheduleItem> working = new ArrayList<>();
        if (catalog != null) {
            for (ScheduleItem entry : catalog) {
                ScheduleItem c = entry.copy();
                c.setUsageCount(0);
                working.add(c);
            }
        }
        rotation.reset();
        ContentSelector selector = new ContentSelector(working, options.largeGapThresholdSeconds());

        Set<Long> exhausted = new HashSet<>();
        Map<String, Integer> categoryCounts = new LinkedHashMap<>();
        int itemsAdded = 0;
        int trimmed = 0;
        int iterations = 0;
        double secondsFilled = 0d;
        boolean limitReached = false;

        logger.info("Filling {} template ({} item(s)) from {} catalog entr(ies), rotation {}",
                timeline.getTopology().token(), timeline.getItems().size(), working.size(), rotation.tokens());

        state = State.COMPUTING_GAPS;
        while (state != State.DONE) {
            Optional<Gap> open = computeGaps(timeline).stream()
                    .filter(g -> !exhausted.contains(key(g)))
                    .findFirst();
            if (open.isEmpty()) {
                state = State.DONE;
                break;
            }
            if (iterations >= options.maxIterations()) {
                logger.warn("Fill stopped after {} iterations with open time remaining", iterations);
                limitReached = true;
                state = State.DONE;
                break;
            }
            iterations++;
            Gap gap = open.get();

            state = State.SELECTING_CONTENT;
            Optional<ContentSelector.Selection> selection = selector.selectNext(gap.duration(), rotation);
            if (selection.isEmpty()) {
                logger.debug("No content for gap [{}, {}) of {}s", gap.startOffset(), gap.endOffset(), gap.duration());
                exhausted.add(key(gap));
                state = State.COMPUTING_GAPS;
                continue;
            }

            state = State.PLACING;
            ScheduleItem chosen = selection.get().item();
            double duration = chosen.getDurationSeconds();
            if (duration > gap.duration() + TimeModel.TOLERANCE_SECONDS) {
                duration = gap.duration();
                trimmed++;
                logger.info("'{}' ({}s) trimmed to {}s to end at {}", chosen.displayTitle(),
                        chosen.getDurationSeconds(), duration, gap.endOffset());
            }
            ScheduleItem placed = chosen.placeAt(gap.startOffset(), duration);
            assertNoOverlap(timeline, placed);
            timeline.addItem(placed);
            timeline.sortItems();

            itemsAdded++;
            secondsFilled += duration;
            String category = chosen.getDurationCategory() == null ? "none" : chosen.getDurationCategory().token();
            categoryCounts.merge(category, 1, Integer::sum);
            if (itemsAdded % 100 == 0) {
                logger.info("Fill progress: {} item(s) added, at {}s of {}s",
                        itemsAdded, placed.getEndOffset(), timeline.getTotalSeconds());
            }
            state = State.COMPUTING_GAPS;
        }

        List<Gap> remaining = computeGaps(timeline);
        populateTimeStrings(timeline, template);
        FillStatus status = remaining.isEmpty() ? FillStatus.COMPLETE : FillStatus.PARTIAL_FILL;
        FillReport report = new FillReport(status, itemsAdded, secondsFilled, trimmed, iterations,
                limitReached, remaining, categoryCounts);
        logger.info("Fill finished: {} item(s), {}s filled, {} gap(s) open ({}s), status {}",
                itemsAdded, String.format("%.3f", secondsFilled), remaining.size(),
                String.format("%.3f", report.remainingSeconds()), status);
        return new FillResult(timeline, report);
    }

    State getState() {
        return state;
    }

    private List<Gap> computeGaps(Timeline timeline) {
        return options.perDayGaps()
                ? gapCalculator.computeDailyGaps(timeline)
                : gapCalculator.computeGaps(timeline);
    }

    private static long key(Gap gap) {
        return Math.round(gap.startOffset() * 1000d);
    }

    private static void assertNoOverlap(Timeline timeline, ScheduleItem candidate) {
        double start = candidate.getStartOffset();
        double end = candidate.getEndOffset();
        for (ScheduleItem existing : timeline.placedItems()) {
            if (start < existing.getEndOffset() - TimeModel.TOLERANCE_SECONDS
                    && end > existing.getStartOffset() + TimeModel.TOLERANCE_SECONDS) {
                logger.error("Refusing placement of '{}' at [{}, {}): overlaps '{}' at [{}, {})",
                        candidate.displayTitle(), start, end,
                        existing.displayTitle(), existing.getStartOffset(), existing.getEndOffset());
                throw new OverlapDetectedException(
                        existing.displayTitle(), existing.getStartOffset(), existing.getEndOffset(),
                        candidate.displayTitle(), start, end);
            }
        }
        if (end > timeline.getTotalSeconds() + TimeModel.TOLERANCE_SECONDS) {
            throw new IllegalStateException("Placement of '" + candidate.displayTitle()
                    + "' runs past the end of the timeline");
        }
    }

    private static void populateTimeStrings(Timeline timeline, Timeline template) {
        TimeFormat format = TimeModel.detectFormat(template.getItems().stream()
                .map(ScheduleItem::getStartTime)
                .toList());
        for (ScheduleItem item : timeline.placedItems()) {
            if (item.getStartTime() == null || item.getStartTime().isBlank()) {
                item.setStartTime(TimeModel.fromOffset(item.getStartOffset(), timeline.getTopology(), format));
            }
            if (item.getEndTime() == null || item.getEndTime().isBlank()) {
                item.setEndTime(TimeModel.fromEndOffset(item.getEndOffset(), timeline.getTopology(), format));
            }
        }
    }
}
