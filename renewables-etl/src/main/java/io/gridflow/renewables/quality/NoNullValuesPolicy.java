package io.gridflow.renewables.quality;

import io.gridflow.core.Table;

import java.util.Map;

/** Fails when any cell of any column is null or absent. */
public final class NoNullValuesPolicy implements QualityPolicy {

    @Override
    public boolean check(Table table) {
        for (Map<String, Object> row : table.rows()) {
            for (String c : table.columns()) {
                if (row.get(c) == null) return false;
            }
        }
        return true;
    }

    @Override
    public String errorMessage() {
        return "Data contains null values.";
    }
}
