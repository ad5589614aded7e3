package com.example.playout.timeline;

import com.example.playout.exception.OverlapDetectedException;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GapCalculatorTest {

    private final GapCalculator calculator = new GapCalculator();

    @Test
    void emptyDailyTimeline_isOneGap() {
        assertThat(calculator.computeGaps(Timeline.daily())).containsExactly(new Gap(0, 86400));
    }

    @Test
    void emptyMonthlyTimeline_spansTheMonth() {
        List<Gap> gaps = calculator.computeGaps(Timeline.monthly(YearMonth.of(2024, 2)));
        assertThat(gaps).containsExactly(new Gap(0, 29 * 86400d));
    }

    @Test
    void fixedItem_splitsDayWithFrameGuardAfterIt() {
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(
                ScheduleItem.fixed("Council meeting", TimeModel.toOffset("17:00:00", Topology.DAILY), 1800)));

        List<Gap> gaps = calculator.computeGaps(timeline);

        assertThat(gaps).hasSize(2);
        assertThat(gaps.get(0)).isEqualTo(new Gap(0, 61200));
        assertThat(gaps.get(1).startOffset()).isCloseTo(63000.0334, within(0.0001));
        assertThat(gaps.get(1).endOffset()).isEqualTo(86400d);
    }

    @Test
    void weeklyMeeting_splitsAtAbsoluteOffset() {
        double start = TimeModel.toOffset("wed 10:00:00", Topology.WEEKLY);
        Timeline timeline = new Timeline(Topology.WEEKLY, 7, List.of(ScheduleItem.fixed("Planning board", start, 3600)));

        List<Gap> gaps = calculator.computeGaps(timeline);

        assertThat(start).isEqualTo(295200d);
        assertThat(gaps).hasSize(2);
        assertThat(gaps.get(0).endOffset()).isEqualTo(295200d);
        assertThat(gaps.get(1).startOffset()).isCloseTo(298800.0334, within(0.0001));
        assertThat(gaps.get(1).endOffset()).isEqualTo(7 * 86400d);
    }

    @Test
    void gapMarker_isAnAnchorAndNeverFillable() {
        ScheduleItem marker = ScheduleItem.gapMarker("Transition", 3600, 600);
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(marker));

        List<Gap> gaps = calculator.computeGaps(timeline);

        assertThat(gaps).hasSize(2);
        assertThat(gaps.get(0)).isEqualTo(new Gap(0, 3600));
        assertThat(gaps.get(1).startOffset()).isGreaterThan(4200d);
        assertThat(gaps).noneMatch(g -> g.startOffset() < 4200d && g.endOffset() > 3600d);
    }

    @Test
    void adjacentAnchors_leaveNoMicroGap() {
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(
                ScheduleItem.fixed("A", 0, 100),
                ScheduleItem.fixed("B", 100, 100),
                ScheduleItem.fixed("C", 200.0005, 100)));

        List<Gap> gaps = calculator.computeGaps(timeline);

        assertThat(gaps).hasSize(1);
        assertThat(gaps.get(0).startOffset()).isCloseTo(300.0339, within(0.0001));
    }

    @Test
    void anchorWithinTolerance_ofCursorOpensNoGap() {
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(ScheduleItem.fixed("Live", 0.0005, 100)));

        List<Gap> gaps = calculator.computeGaps(timeline);

        assertThat(gaps).hasSize(1);
        assertThat(gaps.get(0).startOffset()).isGreaterThan(100d);
    }

    @Test
    void overlappingAnchors_areRejected() {
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(
                ScheduleItem.fixed("Morning show", 3600, 1800),
                ScheduleItem.fixed("Press conference", 4000, 600)));

        assertThatThrownBy(() -> calculator.computeGaps(timeline))
                .isInstanceOf(OverlapDetectedException.class)
                .hasMessageContaining("Press conference");
    }

    @Test
    void dailyGaps_splitWeekAtDayBoundaries() {
        assertThat(calculator.computeDailyGaps(Timeline.weekly()))
                .hasSize(7)
                .allSatisfy(g -> assertThat(g.duration()).isEqualTo(86400d));
    }

    @Test
    void dailyGaps_respectItemCrossingMidnight() {
        Timeline timeline = new Timeline(Topology.WEEKLY, 7, List.of(ScheduleItem.fixed("Late movie", 86000, 800)));

        List<Gap> gaps = calculator.computeDailyGaps(timeline);

        assertThat(gaps).hasSize(7);
        assertThat(gaps.get(0)).isEqualTo(new Gap(0, 86000));
        assertThat(gaps.get(1).startOffset()).isCloseTo(86800.0334, within(0.0001));
        assertThat(gaps.get(1).endOffset()).isEqualTo(172800d);
    }

    @Test
    void dailyGaps_matchPerDayWindowsOnBusyMonth() {
        List<ScheduleItem> items = new ArrayList<>();
        for (int day = 0; day < 31; day++) {
            double base = day * TimeModel.SECONDS_PER_DAY;
            items.add(ScheduleItem.fixed("Morning " + day, base + 21600, 3600));
            items.add(ScheduleItem.fixed("Noon " + day, base + 43200, 1800));
            items.add(ScheduleItem.gapMarker("Break " + day, base + 50000, 120));
            if (day % 3 == 0 && day < 30) {
                items.add(ScheduleItem.fixed("Late " + day, base + 85000, 3000));
            }
        }
        Timeline timeline = new Timeline(Topology.MONTHLY, 31, items);

        List<Gap> expected = new ArrayList<>();
        for (int day = 0; day < 31; day++) {
            expected.addAll(calculator.computeGaps(timeline, timeline.dayStart(day), timeline.dayEnd(day)));
        }

        assertThat(calculator.computeDailyGaps(timeline)).containsExactlyElementsOf(expected);
        assertThat(calculator.computeDailyGaps(timeline))
                .allSatisfy(g -> assertThat(Math.floor(g.startOffset() / TimeModel.SECONDS_PER_DAY))
                        .isEqualTo(Math.floor((g.endOffset() - 1e-6) / TimeModel.SECONDS_PER_DAY)));
    }

    @Test
    void dailyGaps_rejectOverlappingAnchors() {
        Timeline timeline = new Timeline(Topology.WEEKLY, 7, List.of(
                ScheduleItem.fixed("Morning show", 90000, 1800),
                ScheduleItem.fixed("Press conference", 90600, 600)));

        assertThatThrownBy(() -> calculator.computeDailyGaps(timeline))
                .isInstanceOf(OverlapDetectedException.class);
    }

    @Test
    void disabledFrameGuard_gapsAndItemsCoverTimelineExactly() {
        Timeline timeline = new Timeline(Topology.DAILY, 1, List.of(
                ScheduleItem.fixed("A", 1000, 500),
                ScheduleItem.gapMarker("Dead air", 5000, 60)));

        List<Gap> gaps = new GapCalculator(0).computeGaps(timeline);

        assertThat(GapCalculator.totalSeconds(gaps) + 560d).isCloseTo(86400d, within(1e-6));
    }
}
