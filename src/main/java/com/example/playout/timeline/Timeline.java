package com.example.playout.timeline;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A day, week or month being scheduled, with offsets in seconds from its start.
 * Weekly timelines start on Sunday; monthly timelines start on day 1.
 */
public class Timeline {

    private static final Comparator<ScheduleItem> BY_START =
            Comparator.comparingDouble(ScheduleItem::getStartOffset);

    private final Topology topology;
    private final int dayCount;
    private final List<ScheduleItem> items = new ArrayList<>();

    public Timeline(Topology topology, int dayCount, List<ScheduleItem> items) {
        if (topology == null) {
            throw new IllegalArgumentException("topology is required");
        }
        if (dayCount < 1) {
            throw new IllegalArgumentException("dayCount must be positive: " + dayCount);
        }
        if (topology == Topology.DAILY && dayCount != 1) {
            throw new IllegalArgumentException("daily timelines span exactly one day");
        }
        if (topology == Topology.WEEKLY && dayCount != 7) {
            throw new IllegalArgumentException("weekly timelines span exactly seven days");
        }
        this.topology = topology;
        this.dayCount = dayCount;
        if (items != null) {
            items.forEach(this::addItem);
        }
        sortItems();
    }

    public static Timeline daily() {
        return new Timeline(Topology.DAILY, 1, List.of());
    }

    public static Timeline weekly() {
        return new Timeline(Topology.WEEKLY, 7, List.of());
    }

    public static Timeline monthly(YearMonth month) {
        return new Timeline(Topology.MONTHLY, month.lengthOfMonth(), List.of());
    }

    public Topology getTopology() {
        return topology;
    }

    public int getDayCount() {
        return dayCount;
    }

    public double getTotalSeconds() {
        return dayCount * TimeModel.SECONDS_PER_DAY;
    }

    public List<ScheduleItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public void addItem(ScheduleItem item) {
        if (item.isPlaced()) {
            double start = item.getStartOffset();
            if (start < 0 || start >= getTotalSeconds()) {
                throw new IllegalArgumentException("Item '" + item.displayTitle() + "' starts outside the "
                        + topology.token() + " timeline: " + start);
            }
        }
        if (item.getDurationSeconds() < 0) {
            throw new IllegalArgumentException("Item '" + item.displayTitle() + "' has a negative duration");
        }
        items.add(item);
    }

    /**
     * Orders placed items by start offset; unplaced items keep their relative order at the end.
     */
    public void sortItems() {
        List<ScheduleItem> placed = new ArrayList<>();
        List<ScheduleItem> unplaced = new ArrayList<>();
        for (ScheduleItem item : items) {
            (item.isPlaced() ? placed : unplaced).add(item);
        }
        placed.sort(BY_START);
        items.clear();
        items.addAll(placed);
        items.addAll(unplaced);
    }

    public List<ScheduleItem> placedItems() {
        return items.stream().filter(ScheduleItem::isPlaced).sorted(BY_START).toList();
    }

    public double dayStart(int dayIndex) {
        return dayIndex * TimeModel.SECONDS_PER_DAY;
    }

    public double dayEnd(int dayIndex) {
        return Math.min(getTotalSeconds(), (dayIndex + 1) * TimeModel.SECONDS_PER_DAY);
    }

    public Timeline copy() {
        return new Timeline(topology, dayCount, items.stream().map(ScheduleItem::copy).toList());
    }
}
