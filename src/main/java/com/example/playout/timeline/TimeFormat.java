package com.example.playout.timeline;

public enum TimeFormat {
    TWELVE_HOUR,
    TWENTY_FOUR_HOUR
}
