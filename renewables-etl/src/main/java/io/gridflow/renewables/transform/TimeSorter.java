package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Stable ascending sort on an instant column, nulls last. No secondary key: equal instants keep input order.
 */
public class TimeSorter implements Transform<Table, Table> {
    private final String column;

    public TimeSorter(String column) {
        this.column = column;
    }

    @Override
    public Table apply(Table input) throws TransformException {
        if (!input.hasColumn(column)) throw new TransformException("Cannot sort: missing column '" + column + "'");
        for (Map<String, Object> row : input.rows()) {
            Object v = row.get(column);
            if (v != null && !(v instanceof Instant)) {
                throw new TransformException("Cannot sort: '" + column + "' holds " + v.getClass().getSimpleName());
            }
        }
        Comparator<Map<String, Object>> order = Comparator.comparing(
                r -> (Instant) r.get(column), Comparator.nullsLast(Comparator.naturalOrder()));
        return input.sorted(order);
    }
}
