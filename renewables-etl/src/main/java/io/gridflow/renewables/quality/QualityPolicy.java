package io.gridflow.renewables.quality;

import io.gridflow.core.Table;

/**
 * A stateless, read-only check over one normalized table.
 */
public interface QualityPolicy {
    /** True when the table satisfies the policy. Must not modify the table. */
    boolean check(Table table);

    /** Fixed message reported when {@link #check} fails. */
    String errorMessage();

    default String name() {
        return getClass().getSimpleName();
    }
}
