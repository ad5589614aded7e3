package com.example.playout.fill;

import com.example.playout.timeline.DurationCategory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cyclic duration-category order. Repeating a category biases the fill towards it.
 * The index is per-fill state and is reset at the start of every fill.
 */
public class RotationConfig {

    public static final List<DurationCategory> DEFAULT_ORDER = List.of(
            DurationCategory.ID, DurationCategory.SHORT_FORM, DurationCategory.LONG_FORM, DurationCategory.SPOTS);

    private final List<DurationCategory> sequence;
    private int index;

    public RotationConfig(List<DurationCategory> sequence) {
        if (sequence == null || sequence.isEmpty()) {
            throw new IllegalArgumentException("rotation needs at least one category");
        }
        if (sequence.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("rotation contains an empty category");
        }
        this.sequence = List.copyOf(sequence);
    }

    public static RotationConfig of(DurationCategory... categories) {
        return new RotationConfig(Arrays.asList(categories));
    }

    public static RotationConfig defaultRotation() {
        return new RotationConfig(DEFAULT_ORDER);
    }

    public static RotationConfig fromTokens(List<String> tokens) {
        List<DurationCategory> categories = new ArrayList<>();
        if (tokens != null) {
            for (String token : tokens) {
                categories.add(DurationCategory.fromToken(token));
            }
        }
        return new RotationConfig(categories);
    }

    public DurationCategory current() {
        return sequence.get(index % sequence.size());
    }

    public void advance() {
        index++;
    }

    public void reset() {
        index = 0;
    }

    public int getIndex() {
        return index;
    }

    public List<DurationCategory> getSequence() {
        return sequence;
    }

    public List<String> tokens() {
        return sequence.stream().map(DurationCategory::token).toList();
    }
}
