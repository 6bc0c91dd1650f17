package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.util.Map;

/**
 * Renames columns whose name is a key of the mapping; other columns keep their name.
 */
public class ColumnRenamer implements Transform<Table, Table> {
    private final Map<String, String> names;

    public ColumnRenamer(Map<String, String> names) {
        this.names = Map.copyOf(names);
    }

    @Override
    public Table apply(Table input) throws TransformException {
        try {
            return input.renameColumns(c -> names.getOrDefault(c, c));
        } catch (IllegalArgumentException e) {
            throw new TransformException("Column names collide after renaming: " + input.columns(), e);
        }
    }
}
