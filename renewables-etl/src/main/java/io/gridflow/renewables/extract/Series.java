package io.gridflow.renewables.extract;

/**
 * The measurement series pulled by the job, each with its own source file and response format.
 */
public enum Series {
    WIND("Wind", "wind", "windgen.csv", ResponseFormat.ROW_TABULAR),
    SOLAR("Solar", "solar", "solargen.json", ResponseFormat.RECORD_LIST);

    private final String displayName;
    private final String directory;
    private final String fileName;
    private final ResponseFormat format;

    Series(String displayName, String directory, String fileName, ResponseFormat format) {
        this.displayName = displayName;
        this.directory = directory;
        this.fileName = fileName;
        this.format = format;
    }

    public String displayName() { return displayName; }
    /** Lower-case name used for output directories and files. */
    public String directory() { return directory; }
    public String fileName() { return fileName; }
    public ResponseFormat format() { return format; }
}
