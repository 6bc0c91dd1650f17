package io.gridflow.renewables.extract;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * The fixed trailing window of whole UTC days before the reference day; the reference day itself is excluded.
 */
public final class TrailingWindow {
    public static final int DAYS = 7;

    private TrailingWindow() {}

    public static LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    /** Days {@code endExclusive - 7 .. endExclusive - 1}, ascending. */
    public static List<LocalDate> endingBefore(LocalDate endExclusive) {
        List<LocalDate> days = new ArrayList<>(DAYS);
        for (int i = DAYS; i >= 1; i--) days.add(endExclusive.minusDays(i));
        return days;
    }
}
