package io.gridflow.renewables.transform;

import io.gridflow.core.Table;
import io.gridflow.core.Transform;
import io.gridflow.transform.TransformException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Casts columns to fixed scalar types. Columns are matched by canonical name and every mapped column must
 * be present. Malformed cells fail the table rather than becoming null.
 */
public class TypeCaster implements Transform<Table, Table> {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Map<String, ColumnType> types;

    public TypeCaster(Map<String, ColumnType> types) {
        this.types = Map.copyOf(types);
    }

    @Override
    public Table apply(Table input) throws TransformException {
        Map<String, ColumnType> byColumn = new LinkedHashMap<>();
        for (String c : input.columns()) {
            ColumnType type = types.get(ColumnConfig.canonical(c));
            if (type != null) byColumn.put(c, type);
        }
        if (byColumn.size() != types.size()) {
            throw new TransformException("Expected columns " + types.keySet() + " but got " + input.columns());
        }

        Table.Builder b = Table.builder(input.columns());
        for (Map<String, Object> row : input.rows()) {
            Map<String, Object> out = new LinkedHashMap<>(row);
            for (Map.Entry<String, ColumnType> e : byColumn.entrySet()) {
                out.put(e.getKey(), cast(e.getKey(), row.get(e.getKey()), e.getValue()));
            }
            b.addRow(out);
        }
        return b.build();
    }

    static Object cast(String column, Object value, ColumnType type) throws CastException {
        return switch (type) {
            case INTEGER -> toLong(column, value);
            case DOUBLE -> toDouble(column, value);
        };
    }

    private static Long toLong(String column, Object value) throws CastException {
        if (value instanceof Long l) return l;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number) value).longValue();
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= Long.MAX_VALUE) return (long) d;
        } else if (value instanceof CharSequence cs) {
            String s = cs.toString().strip();
            if (!DECIMAL.matcher(s).matches()) throw new CastException(column, value, "integer");
            try {
                return new BigDecimal(s).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new CastException(column, value, "integer", e);
            }
        }
        throw new CastException(column, value, "integer");
    }

    // null stays null here; the quality gate rejects it
    private static Double toDouble(String column, Object value) throws CastException {
        if (value == null) return null;
        if (value instanceof Double d) return d;
        if (value instanceof Number n && !(value instanceof Double)) return n.doubleValue();
        if (value instanceof CharSequence cs) {
            String s = cs.toString().strip();
            if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s);
        }
        throw new CastException(column, value, "floating point");
    }
}
