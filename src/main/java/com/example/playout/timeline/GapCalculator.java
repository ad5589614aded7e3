package com.example.playout.timeline;

import com.example.playout.exception.OverlapDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the unoccupied intervals of a timeline.
 * <p>
 * Every item with a start offset is an anchor: fixed-time items, gap markers and earlier fill
 * placements alike. The walk resumes one frame after each anchor ends, so a gap never starts
 * on the exact boundary of the item before it.
 */
public class GapCalculator {

    private static final Logger logger = LoggerFactory.getLogger(GapCalculator.class);

    private final double frameRate;

    public GapCalculator() {
        this(TimeModel.DEFAULT_FRAME_RATE);
    }

    public GapCalculator(double frameRate) {
        this.frameRate = frameRate;
    }

    public double getFrameRate() {
        return frameRate;
    }

    public List<Gap> computeGaps(Timeline timeline) {
        return computeGaps(timeline, 0d, timeline.getTotalSeconds());
    }

    /**
     * Gaps inside [from, to). Anchors outside the window still push the cursor when they reach into it.
     */
    public List<Gap> computeGaps(Timeline timeline, double from, double to) {
        List<ScheduleItem> anchors = timeline.placedItems();
        validateAnchors(anchors);
        List<Gap> gaps = walk(anchors, from, to);
        logger.debug("{} gap(s) in [{}, {}) across {} anchor(s)", gaps.size(), from, to, anchors.size());
        return gaps;
    }

    /**
     * Gaps split at day boundaries. Anchors are sorted and validated once, then walked per day.
     */
    public List<Gap> computeDailyGaps(Timeline timeline) {
        List<ScheduleItem> anchors = timeline.placedItems();
        validateAnchors(anchors);
        List<Gap> gaps = new ArrayList<>();
        int first = 0;
        for (int day = 0; day < timeline.getDayCount(); day++) {
            double from = timeline.dayStart(day);
            // anchors that end before this day can no longer move the cursor
            while (first < anchors.size()
                    && TimeModel.addFrameGuard(anchors.get(first).getEndOffset(), frameRate) <= from) {
                first++;
            }
            gaps.addAll(walk(anchors.subList(first, anchors.size()), from, timeline.dayEnd(day)));
        }
        logger.debug("{} daily gap(s) over {} day(s) across {} anchor(s)",
                gaps.size(), timeline.getDayCount(), anchors.size());
        return gaps;
    }

    private List<Gap> walk(List<ScheduleItem> anchors, double from, double to) {
        List<Gap> gaps = new ArrayList<>();
        double cursor = from;
        for (ScheduleItem anchor : anchors) {
            double start = anchor.getStartOffset();
            if (start >= to - TimeModel.TOLERANCE_SECONDS) {
                break;
            }
            if (start - cursor > TimeModel.TOLERANCE_SECONDS) {
                gaps.add(new Gap(cursor, start));
            }
            cursor = Math.max(cursor, TimeModel.addFrameGuard(anchor.getEndOffset(), frameRate));
        }
        if (to - cursor > TimeModel.TOLERANCE_SECONDS) {
            gaps.add(new Gap(cursor, to));
        }
        return gaps;
    }

    public static double totalSeconds(List<Gap> gaps) {
        return gaps.stream().mapToDouble(Gap::duration).sum();
    }

    private void validateAnchors(List<ScheduleItem> sorted) {
        ScheduleItem furthest = null;
        for (ScheduleItem anchor : sorted) {
            if (furthest != null && anchor.getStartOffset() < furthest.getEndOffset() - TimeModel.TOLERANCE_SECONDS) {
                throw new OverlapDetectedException(
                        furthest.displayTitle(), furthest.getStartOffset(), furthest.getEndOffset(),
                        anchor.displayTitle(), anchor.getStartOffset(), anchor.getEndOffset());
            }
            if (furthest == null || anchor.getEndOffset() > furthest.getEndOffset()) {
                furthest = anchor;
            }
        }
    }
}
