package io.cutpool.storage;

/**
 * Outcome of a soft delete.
 */
public enum DeleteResult {
    /**
     * The slot is empty now (or already was).
     */
    REMOVED,
    /**
     * The payload refused deletion; the slot is unchanged.
     */
    STILL_REFERENCED
}
