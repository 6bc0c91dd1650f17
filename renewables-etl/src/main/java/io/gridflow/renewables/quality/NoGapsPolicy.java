package io.gridflow.renewables.quality;

import io.gridflow.core.Table;
import io.gridflow.renewables.transform.ColumnConfig;
import io.gridflow.renewables.transform.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Fails when two time-adjacent rows are further apart than the allowed gap, or when the timestamp column
 * is missing. Rows are sorted here, independently of the table's own order. Null timestamps are skipped.
 */
public final class NoGapsPolicy implements QualityPolicy {
    public static final Duration MAX_GAP = Duration.ofSeconds(300);

    private final String column;
    private final Duration maxGap;

    public NoGapsPolicy() {
        this(ColumnConfig.TIMESTAMP, MAX_GAP);
    }

    public NoGapsPolicy(String column, Duration maxGap) {
        this.column = column;
        this.maxGap = maxGap;
    }

    @Override
    public boolean check(Table table) {
        if (!table.hasColumn(column)) return false;
        List<Instant> times = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.rows()) {
            Object v = row.get(column);
            if (v == null) continue;
            try {
                times.add(v instanceof Instant i ? i : Timestamps.parseText(v));
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        Collections.sort(times);
        for (int i = 1; i < times.size(); i++) {
            if (Duration.between(times.get(i - 1), times.get(i)).compareTo(maxGap) > 0) return false;
        }
        return true;
    }

    @Override
    public String errorMessage() {
        return "Data contains gaps.";
    }
}
