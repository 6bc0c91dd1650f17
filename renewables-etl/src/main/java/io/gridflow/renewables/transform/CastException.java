package io.gridflow.renewables.transform;

import io.gridflow.transform.TransformException;

/**
 * A cell could not be converted to its column's target type.
 */
public class CastException extends TransformException {
    private final String column;
    private final Object value;
    private final String targetType;

    public CastException(String column, Object value, String targetType) {
        this(column, value, targetType, null);
    }

    public CastException(String column, Object value, String targetType, Throwable cause) {
        super("Cannot cast value '" + value + "' in column '" + column + "' to " + targetType, cause);
        this.column = column;
        this.value = value;
        this.targetType = targetType;
    }

    public String column() { return column; }
    public Object value() { return value; }
    public String targetType() { return targetType; }
}
