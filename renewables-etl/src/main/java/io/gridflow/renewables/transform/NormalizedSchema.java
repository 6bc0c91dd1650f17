package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Requires exactly the normalized columns and lays them out in their canonical order.
 */
public class NormalizedSchema implements Transform<Table, Table> {
    private final List<String> columns;

    public NormalizedSchema() {
        this(ColumnConfig.NORMALIZED_COLUMNS);
    }

    public NormalizedSchema(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public Table apply(Table input) throws TransformException {
        Set<String> actual = new HashSet<>(input.columns());
        if (!actual.equals(new HashSet<>(columns))) {
            Set<String> missing = new HashSet<>(columns);
            missing.removeAll(actual);
            Set<String> unexpected = new HashSet<>(actual);
            unexpected.removeAll(columns);
            throw new TransformException("Normalized table must have columns " + columns
                    + "; missing " + missing + ", unexpected " + unexpected);
        }
        if (input.columns().equals(columns)) return input;
        Table.Builder b = Table.builder(columns);
        input.rows().forEach(b::addRow);
        return b.build();
    }
}
