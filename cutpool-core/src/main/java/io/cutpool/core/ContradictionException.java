package io.cutpool.core;

/**
 * Conflicting fix/set requests on the same variable.
 * Indicates an inconsistent model and is never retried.
 */
public class ContradictionException extends CutPoolException {

    public ContradictionException(String message) {
        super(message);
    }
}
