package io.cutpool.testutil;

import io.cutpool.kernel.ManagedObject;

/**
 * Item whose deletability is switched by the test; no reference counting.
 */
public final class FlagItem implements ManagedObject {

    private final String name;
    private boolean deletable;

    public FlagItem(String name, boolean deletable) {
        this.name = name;
        this.deletable = deletable;
    }

    public static FlagItem deletable(String name) {
        return new FlagItem(name, true);
    }

    public static FlagItem pinned(String name) {
        return new FlagItem(name, false);
    }

    public void deletable(boolean deletable) {
        this.deletable = deletable;
    }

    @Override
    public boolean deletable() {
        return deletable;
    }

    @Override
    public String toString() {
        return name;
    }
}
