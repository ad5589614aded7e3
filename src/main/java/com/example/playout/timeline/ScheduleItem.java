package com.example.playout.timeline;

import java.util.Objects;

/**
 * One placed or placeable unit on a timeline. Catalog entries are items without a start offset;
 * template anchors and fill placements carry one. The end offset is always derived.
 */
public class ScheduleItem {

    private String id;
    private String title;
    private String filePath;
    private double durationSeconds;
    private Double startOffset;
    private DurationCategory durationCategory;
    private boolean fixedTime;
    private boolean gapMarker;
    private int usageCount;

    // Carried through from the catalog, not interpreted by the engine
    private String contentType;
    private String guid;
    private Double engagementScore;

    // Display strings, filled on output
    private String startTime;
    private String endTime;

    public ScheduleItem() {
    }

    public ScheduleItem(String id, String title, double durationSeconds, DurationCategory durationCategory) {
        this.id = id;
        this.title = title;
        this.durationSeconds = durationSeconds;
        this.durationCategory = durationCategory;
    }

    public static ScheduleItem fixed(String title, double startOffset, double durationSeconds) {
        ScheduleItem item = new ScheduleItem(null, title, durationSeconds, null);
        item.setStartOffset(startOffset);
        item.setFixedTime(true);
        return item;
    }

    public static ScheduleItem gapMarker(String title, double startOffset, double durationSeconds) {
        ScheduleItem item = new ScheduleItem(null, title, durationSeconds, null);
        item.setStartOffset(startOffset);
        item.setGapMarker(true);
        return item;
    }

    /**
     * A fresh item for a catalog entry, positioned at {@code start}. The usage counter is not copied.
     */
    public ScheduleItem placeAt(double start, double duration) {
        ScheduleItem placed = copy();
        placed.usageCount = 0;
        placed.durationSeconds = duration;
        placed.startOffset = start;
        placed.fixedTime = false;
        placed.gapMarker = false;
        placed.startTime = null;
        placed.endTime = null;
        return placed;
    }

    public ScheduleItem copy() {
        ScheduleItem c = new ScheduleItem(id, title, durationSeconds, durationCategory);
        c.filePath = filePath;
        c.startOffset = startOffset;
        c.fixedTime = fixedTime;
        c.gapMarker = gapMarker;
        c.usageCount = usageCount;
        c.contentType = contentType;
        c.guid = guid;
        c.engagementScore = engagementScore;
        c.startTime = startTime;
        c.endTime = endTime;
        return c;
    }

    public boolean isPlaced() {
        return startOffset != null;
    }

    /**
     * Fixed-time items and gap markers; the fill never moves them.
     */
    public boolean isAnchorOnly() {
        return fixedTime || gapMarker;
    }

    public Double getEndOffset() {
        return startOffset == null ? null : startOffset + durationSeconds;
    }

    public void incrementUsage() {
        usageCount++;
    }

    public String displayTitle() {
        if (title != null && !title.isBlank()) return title;
        if (filePath != null && !filePath.isBlank()) return filePath;
        return id != null ? id : "(untitled)";
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }

    public double getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(double durationSeconds) { this.durationSeconds = durationSeconds; }

    public Double getStartOffset() { return startOffset; }
    public void setStartOffset(Double startOffset) { this.startOffset = startOffset; }

    public DurationCategory getDurationCategory() { return durationCategory; }
    public void setDurationCategory(DurationCategory durationCategory) { this.durationCategory = durationCategory; }

    public boolean isFixedTime() { return fixedTime; }
    public void setFixedTime(boolean fixedTime) { this.fixedTime = fixedTime; }

    public boolean isGapMarker() { return gapMarker; }
    public void setGapMarker(boolean gapMarker) { this.gapMarker = gapMarker; }

    public int getUsageCount() { return usageCount; }
    public void setUsageCount(int usageCount) { this.usageCount = usageCount; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public String getGuid() { return guid; }
    public void setGuid(String guid) { this.guid = guid; }

    public Double getEngagementScore() { return engagementScore; }
    public void setEngagementScore(Double engagementScore) { this.engagementScore = engagementScore; }

    public String getStartTime() { return startTime; }
    public void setStartTime(String startTime) { this.startTime = startTime; }

    public String getEndTime() { return endTime; }
    public void setEndTime(String endTime) { this.endTime = endTime; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduleItem that = (ScheduleItem) o;
        return Double.compare(that.durationSeconds, durationSeconds) == 0
                && fixedTime == that.fixedTime
                && gapMarker == that.gapMarker
                && Objects.equals(id, that.id)
                && Objects.equals(title, that.title)
                && Objects.equals(startOffset, that.startOffset)
                && durationCategory == that.durationCategory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, durationSeconds, startOffset, durationCategory, fixedTime, gapMarker);
    }

    @Override
    public String toString() {
        return "ScheduleItem{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", durationSeconds=" + durationSeconds +
                ", startOffset=" + startOffset +
                ", durationCategory=" + durationCategory +
                ", fixedTime=" + fixedTime +
                ", gapMarker=" + gapMarker +
                '}';
    }
}
