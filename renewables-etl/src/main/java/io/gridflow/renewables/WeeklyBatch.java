package io.gridflow.renewables;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Normalized tables of one run together with the day the run was anchored to. Both the extraction window
 * and the output partition derive from {@code referenceDay}.
 */
public record WeeklyBatch(LocalDate referenceDay, SeriesTables tables) {
    public WeeklyBatch {
        Objects.requireNonNull(referenceDay, "referenceDay");
        Objects.requireNonNull(tables, "tables");
    }
}
