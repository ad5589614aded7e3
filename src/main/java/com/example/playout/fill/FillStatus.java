package com.example.playout.fill;

public enum FillStatus {
    /** No open time left. */
    COMPLETE,
    /** Open time remains, either unfillable or cut off by the iteration bound. */
    PARTIAL_FILL
}
