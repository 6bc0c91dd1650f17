package io.gridflow.renewables.transform;

public enum ColumnType {
    /** 64-bit signed integer, held as {@link Long}. */
    INTEGER,
    /** Double precision floating point, held as {@link Double}. */
    DOUBLE
}
