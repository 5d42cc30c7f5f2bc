package com.example.taskreminder.domain;

import com.example.taskreminder.exception.InvalidReminderOffsetException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Validation and normalization of reminder offset lists.
 * <p>
 * Offsets must be positive. Duplicates are collapsed, keeping the order
 * of first appearance, so one task never sends the same reminder twice.
 */
public final class ReminderOffsets {

    private ReminderOffsets() {
    }

    public static List<Integer> normalize(List<Integer> offsets) {
        if (offsets == null || offsets.isEmpty()) {
            return List.of();
        }
        var unique = new LinkedHashSet<Integer>();
        for (var offset : offsets) {
            if (offset == null) {
                throw new InvalidReminderOffsetException(null);
            }
            requirePositive(offset);
            unique.add(offset);
        }
        return new ArrayList<>(unique);
    }

    public static void requirePositive(int offsetMinutes) {
        if (offsetMinutes <= 0) {
            throw new InvalidReminderOffsetException(offsetMinutes);
        }
    }
}
