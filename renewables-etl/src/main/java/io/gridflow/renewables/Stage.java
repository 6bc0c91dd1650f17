package io.gridflow.renewables;

/** Stages of a run, in execution order. */
public enum Stage {
    EXTRACT,
    TRANSFORM,
    QUALITY,
    LOAD
}
