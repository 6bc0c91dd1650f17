package io.gridflow.renewables.transform;

/**
 * How raw timestamp cells are encoded. Chosen per series by the caller, never inferred from the data.
 */
public enum TimestampUnit {
    /** Date-time text such as {@code 2024-06-01 00:05:00}; no offset means UTC. */
    TEXT,
    EPOCH_MILLIS,
    EPOCH_SECONDS
}
