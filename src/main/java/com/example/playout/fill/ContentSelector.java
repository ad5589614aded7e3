package com.example.playout.fill;

import com.example.playout.timeline.ScheduleItem;
import com.example.playout.timeline.TimeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the next catalog item for a gap. Within each tier the least-used item wins and ties
 * go to the earlier catalog entry.
 */
public class ContentSelector {

    private static final Logger logger = LoggerFactory.getLogger(ContentSelector.class);

    public enum Tier {
        /** Matches the rotation's category and fits. */
        CATEGORY_MATCH,
        /** Fits, category relaxed. */
        ANY_CATEGORY,
        /** Least-used item regardless of fit, only for large gaps. */
        LAST_RESORT
    }

    public record Selection(ScheduleItem item, Tier tier) {
    }

    private final List<ScheduleItem> catalog;
    private final double largeGapThresholdSeconds;

    public ContentSelector(List<ScheduleItem> catalog, double largeGapThresholdSeconds) {
        this.catalog = catalog == null ? List.of() : catalog;
        this.largeGapThresholdSeconds = largeGapThresholdSeconds;
    }

    /**
     * Returns empty when nothing can go into {@code remainingBudget} seconds. A successful
     * selection bumps the item's usage counter and advances the rotation once.
     */
    public Optional<Selection> selectNext(double remainingBudget, RotationConfig rotation) {
        var target = rotation.current();
        Predicate<ScheduleItem> fits = item -> item.getDurationSeconds() <= remainingBudget + TimeModel.TOLERANCE_SECONDS;

        Optional<ScheduleItem> pick = leastUsed(fits.and(item -> item.getDurationCategory() == target));
        Tier tier = Tier.CATEGORY_MATCH;
        if (pick.isEmpty()) {
            pick = leastUsed(fits);
            tier = Tier.ANY_CATEGORY;
            if (pick.isPresent()) {
                logger.debug("No {} content fits {}s, relaxed to {}", target.token(), remainingBudget,
                        pick.get().displayTitle());
            }
        }
        if (pick.isEmpty() && remainingBudget > largeGapThresholdSeconds) {
            pick = leastUsed(item -> true);
            tier = Tier.LAST_RESORT;
            pick.ifPresent(item -> logger.debug("Nothing fits {}s, last resort {}", remainingBudget, item.displayTitle()));
        }
        if (pick.isEmpty()) {
            return Optional.empty();
        }
        ScheduleItem chosen = pick.get();
        chosen.incrementUsage();
        rotation.advance();
        return Optional.of(new Selection(chosen, tier));
    }

    private Optional<ScheduleItem> leastUsed(Predicate<ScheduleItem> filter) {
        ScheduleItem best = null;
        for (ScheduleItem item : catalog) {
            if (item.getDurationSeconds() <= 0 || !filter.test(item)) {
                continue;
            }
            if (best == null || item.getUsageCount() < best.getUsageCount()) {
                best = item;
            }
        }
        return Optional.ofNullable(best);
    }
}
