package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the naive timestamp and last-modified columns into UTC instants, then renames the naive column
 * to {@link ColumnConfig#TIMESTAMP}. Output of an earlier run (already localized) passes through unchanged.
 */
public class TimestampLocalizer implements Transform<Table, Table> {
    private final TimestampUnit unit;

    public TimestampLocalizer(TimestampUnit unit) {
        this.unit = Objects.requireNonNull(unit);
    }

    @Override
    public Table apply(Table input) throws TransformException {
        String naive = find(input, ColumnConfig.NAIVE_TIMESTAMP, ColumnConfig.TIMESTAMP);
        String modified = find(input, ColumnConfig.LAST_MODIFIED, null);

        List<String> columns = new ArrayList<>(input.columns());
        columns.set(columns.indexOf(naive), ColumnConfig.TIMESTAMP);
        if (!naive.equals(ColumnConfig.TIMESTAMP) && input.hasColumn(ColumnConfig.TIMESTAMP)) {
            throw new TransformException("Both '" + naive + "' and '" + ColumnConfig.TIMESTAMP + "' present");
        }

        Table.Builder b = Table.builder(columns);
        for (Map<String, Object> row : input.rows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                String c = cell.getKey();
                if (c.equals(naive)) {
                    out.put(ColumnConfig.TIMESTAMP, localize(c, cell.getValue()));
                } else if (c.equals(modified)) {
                    out.put(c, localize(c, cell.getValue()));
                } else {
                    out.put(c, cell.getValue());
                }
            }
            b.addRow(out);
        }
        return b.build();
    }

    private Instant localize(String column, Object value) throws CastException {
        try {
            return Timestamps.toInstant(value, unit);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new CastException(column, value, "UTC timestamp (" + unit + ")", e);
        }
    }

    private static String find(Table t, String canonical, String alternative) throws TransformException {
        for (String c : t.columns()) {
            String name = ColumnConfig.canonical(c);
            if (name.equals(canonical) || name.equals(alternative)) return c;
        }
        throw new TransformException("Missing timestamp column '" + canonical + "' in " + t.columns());
    }
}
