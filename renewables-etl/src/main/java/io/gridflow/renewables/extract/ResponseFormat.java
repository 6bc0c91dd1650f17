package io.gridflow.renewables.extract;

/** How a response body is laid out. */
public enum ResponseFormat {
    /** Delimited text with a header row. */
    ROW_TABULAR,
    /** JSON array of flat objects. */
    RECORD_LIST
}
