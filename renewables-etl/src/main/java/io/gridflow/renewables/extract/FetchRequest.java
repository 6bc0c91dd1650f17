package io.gridflow.renewables.extract;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One GET against the data source: a single day of a single series.
 */
public record FetchRequest(LocalDate date, Series series, String resourcePath, ResponseFormat format) {
    public FetchRequest {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(resourcePath, "resourcePath");
        Objects.requireNonNull(format, "format");
    }

    public static FetchRequest of(LocalDate date, Series series) {
        return new FetchRequest(date, series, date + "/renewables/" + series.fileName(), series.format());
    }

    @Override
    public String toString() {
        return series.displayName() + "@" + date;
    }
}
