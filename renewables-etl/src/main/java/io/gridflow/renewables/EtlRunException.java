package io.gridflow.renewables;

/**
 * A run aborted. Carries the stage that failed; the underlying failure is the cause.
 */
public class EtlRunException extends Exception {
    private final Stage stage;

    public EtlRunException(Stage stage, Throwable cause) {
        super("ETL pipeline failed at " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public Stage stage() { return stage; }
}
