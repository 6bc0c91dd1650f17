package io.gridflow.core;

import java.io.Closeable;

/**
 * Sink consumes fully validated items, typically persisting them.
 */
public interface Sink<T> extends Closeable {
    void accept(T item) throws Exception;

    @Override
    default void close() {}
}
