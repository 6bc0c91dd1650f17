package io.gridflow.renewables.transform;

import java.util.List;
import java.util.Map;

/**
 * Column names and types of the normalized wind/solar tables, plus the fixed mappings used to get there.
 * Lookups go through {@link #canonical(String)} so raw, normalized and final spellings all resolve.
 */
public final class ColumnConfig {
    public static final String TIMESTAMP = "Timezone_Aware_Timestamp";
    public static final String VARIABLE = "Variable";
    public static final String VALUE = "Value";
    public static final String LAST_MODIFIED = "Last_Modified_Utc";

    /** Canonical name of the raw, zone-less timestamp column. */
    public static final String NAIVE_TIMESTAMP = "Naive_Timestamp";

    public static final List<String> NORMALIZED_COLUMNS = List.of(TIMESTAMP, VARIABLE, VALUE, LAST_MODIFIED);

    public static final Map<String, ColumnType> COLUMN_TYPES = Map.of(
            VARIABLE, ColumnType.INTEGER,
            VALUE, ColumnType.DOUBLE
    );

    public static final Map<String, String> CUSTOM_COLUMN_NAMES = Map.of(
            "Val", VALUE,
            "Values", VALUE,
            "Last_Modified", LAST_MODIFIED
    );

    private ColumnConfig() {}

    /** Normalized form with the custom renames applied. */
    public static String canonical(String column) {
        String normalized = ColumnNameNormalizer.normalize(column);
        return CUSTOM_COLUMN_NAMES.getOrDefault(normalized, normalized);
    }
}
