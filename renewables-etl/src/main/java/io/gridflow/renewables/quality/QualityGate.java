package io.gridflow.renewables.quality;

import io.gridflow.core.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every policy against every table, policy-major then table-major, and stops at the first failure.
 * Read-only: tables are never modified.
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final List<QualityPolicy> policies;

    public QualityGate(List<QualityPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static void evaluate(List<QualityPolicy> policies, Map<String, Table> tables) throws QualityFailureException {
        new QualityGate(policies).evaluate(tables);
    }

    public void evaluate(Map<String, Table> tables) throws QualityFailureException {
        Optional<QualityViolation> failure = firstViolation(tables);
        if (failure.isPresent()) throw new QualityFailureException(failure.get());
    }

    /** The first failing (policy, table) pair in evaluation order, if any. */
    public Optional<QualityViolation> firstViolation(Map<String, Table> tables) {
        for (QualityPolicy policy : policies) {
            for (Map.Entry<String, Table> e : tables.entrySet()) {
                if (!policy.check(e.getValue())) {
                    return Optional.of(new QualityViolation(policy.name(), e.getKey(), policy.errorMessage()));
                }
                log.debug("{} passed on {}", policy.name(), e.getKey());
            }
        }
        return Optional.empty();
    }
}
