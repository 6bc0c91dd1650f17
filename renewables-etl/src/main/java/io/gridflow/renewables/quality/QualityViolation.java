package io.gridflow.renewables.quality;

/** Which policy failed on which table. */
public record QualityViolation(String policyName, String tableName, String message) {
    public String describe() {
        return tableName + " data quality check failed: " + message;
    }
}
