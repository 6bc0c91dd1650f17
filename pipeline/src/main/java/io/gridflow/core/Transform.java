package io.gridflow.core;

import io.gridflow.transform.TransformException;

/**
 * Transform converts an input into an output without side effects.
 * Implementations must be deterministic for a given input.
 */
public interface Transform<I, O> {
    O apply(I input) throws TransformException;
}
