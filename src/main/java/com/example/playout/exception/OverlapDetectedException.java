package com.example.playout.exception;

/**
 * Two intervals on a timeline intersect. Raised for inconsistent input anchors
 * and for placements that would cover an existing item; never repaired locally.
 */
public class OverlapDetectedException extends ScheduleFillException {

    private final String existingTitle;
    private final double existingStart;
    private final double existingEnd;
    private final String offendingTitle;
    private final double offendingStart;
    private final double offendingEnd;

    public OverlapDetectedException(String existingTitle, double existingStart, double existingEnd,
                                    String offendingTitle, double offendingStart, double offendingEnd) {
        super("OVERLAP_DETECTED",
                String.format("'%s' [%.3f, %.3f) overlaps '%s' [%.3f, %.3f)",
                        offendingTitle, offendingStart, offendingEnd,
                        existingTitle, existingStart, existingEnd),
                existingTitle, offendingTitle);
        this.existingTitle = existingTitle;
        this.existingStart = existingStart;
        this.existingEnd = existingEnd;
        this.offendingTitle = offendingTitle;
        this.offendingStart = offendingStart;
        this.offendingEnd = offendingEnd;
    }

    public String getExistingTitle() { return existingTitle; }
    public double getExistingStart() { return existingStart; }
    public double getExistingEnd() { return existingEnd; }
    public String getOffendingTitle() { return offendingTitle; }
    public double getOffendingStart() { return offendingStart; }
    public double getOffendingEnd() { return offendingEnd; }
}
