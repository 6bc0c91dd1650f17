package io.gridflow.renewables.quality;

public class QualityFailureException extends Exception {
    private final QualityViolation violation;

    public QualityFailureException(QualityViolation violation) {
        super(violation.describe());
        this.violation = violation;
    }

    public QualityViolation violation() { return violation; }
    public String policyName() { return violation.policyName(); }
    public String tableName() { return violation.tableName(); }
}
