package io.cutpool.runtime;

import io.cutpool.core.CutPoolConfiguration;

/**
 * Whether a pool machinery instance works on constraints or on variables.
 * Selects the matching per-round limits of a {@link CutPoolConfiguration}.
 */
public enum ItemKind {
    CONSTRAINT,
    VARIABLE;

    /**
     * {@code MaxConBuffered} or {@code MaxVarBuffered}.
     */
    public int maxBuffered(CutPoolConfiguration configuration) {
        return this == CONSTRAINT ? configuration.maxConBuffered() : configuration.maxVarBuffered();
    }

    /**
     * {@code MaxConAdd} or {@code MaxVarAdd}.
     */
    public int maxAdd(CutPoolConfiguration configuration) {
        return this == CONSTRAINT ? configuration.maxConAdd() : configuration.maxVarAdd();
    }

    /**
     * {@code ConElimAge} or {@code VarElimAge}.
     */
    public int elimAge(CutPoolConfiguration configuration) {
        return this == CONSTRAINT ? configuration.conElimAge() : configuration.varElimAge();
    }
}
