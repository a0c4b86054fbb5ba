package io.cutpool.runtime;

/**
 * Outcome of offering an item to a staging buffer or separator.
 */
public enum InsertResult {
    ADDED,
    /**
     * An equal item was already generated or pooled; the offered one was discarded.
     */
    DUPLICATION,
    /**
     * No room left; the caller should skip the item or stop generating.
     */
    FULL
}
