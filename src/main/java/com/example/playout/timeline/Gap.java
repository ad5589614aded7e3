package com.example.playout.timeline;

/**
 * A maximal unoccupied interval [startOffset, endOffset) on a timeline.
 */
public record Gap(double startOffset, double endOffset) {

    public Gap {
        if (!(endOffset > startOffset)) {
            throw new IllegalArgumentException("Gap end must be after start: " + startOffset + " - " + endOffset);
        }
    }

    public double duration() {
        return endOffset - startOffset;
    }
}
