package com.example.playout.fill;

import com.example.playout.timeline.Timeline;

public record FillResult(Timeline timeline, FillReport report) {
}
