package io.gridflow.renewables;

import io.gridflow.core.Table;
import io.gridflow.renewables.extract.Series;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The wind and solar tables of one run, moved together between stages.
 */
public record SeriesTables(Table wind, Table solar) {
    public SeriesTables {
        Objects.requireNonNull(wind, "wind");
        Objects.requireNonNull(solar, "solar");
    }

    public Table get(Series series) {
        return series == Series.WIND ? wind : solar;
    }

    /** Display name to table, wind first. */
    public Map<String, Table> byName() {
        Map<String, Table> named = new LinkedHashMap<>();
        named.put(Series.WIND.displayName(), wind);
        named.put(Series.SOLAR.displayName(), solar);
        return named;
    }
}
