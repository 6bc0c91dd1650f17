package io.gridflow.transform;

import io.gridflow.core.Transform;

import java.util.List;

/**
 * Sequentially applies transforms of the same type, feeding each stage the previous stage's output.
 */
public class TransformChain<T> implements Transform<T, T> {
    private final List<Transform<T, T>> stages;

    @SafeVarargs
    public TransformChain(Transform<T, T>... stages) {
        this(List.of(stages));
    }

    public TransformChain(List<Transform<T, T>> stages) {
        this.stages = List.copyOf(stages);
    }

    public List<Transform<T, T>> stages() { return stages; }

    @Override
    public T apply(T input) throws TransformException {
        T current = input;
        for (Transform<T, T> stage : stages) {
            current = stage.apply(current);
            if (current == null) {
                throw new TransformException("Stage " + stage.getClass().getSimpleName() + " returned null");
            }
        }
        return current;
    }
}
