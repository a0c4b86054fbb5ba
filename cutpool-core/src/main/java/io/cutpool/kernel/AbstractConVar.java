package io.cutpool.kernel;

/**
 * Base class for constraints and variables that derive their deletability
 * from how often they are referenced and locked.
 * <p>
 * Active sets add a reference and an activation for every live entry; staging
 * buffers lock the items they hold. An object is deletable once nothing
 * references or locks it any more.
 * <p>
 * Counters going negative indicate unbalanced calls and fail fast.
 */
public abstract class AbstractConVar implements ManagedObject {

    private final boolean dynamic;
    private final boolean local;
    private int references;
    private int activations;
    private int locks;

    /**
     * @param dynamic true if the item may be removed from the active set again
     * @param local   true if the item is valid only in the subtree where it was generated
     */
    protected AbstractConVar(boolean dynamic, boolean local) {
        this.dynamic = dynamic;
        this.local = local;
    }

    @Override
    public boolean deletable() {
        return references == 0 && locks == 0;
    }

    @Override
    public boolean dynamic() {
        return dynamic;
    }

    public boolean local() {
        return local;
    }

    public boolean global() {
        return !local;
    }

    @Override
    public void addReference() {
        references++;
    }

    @Override
    public void removeReference() {
        if (references == 0) {
            throw new IllegalStateException("reference counter negative for " + this);
        }
        references--;
    }

    @Override
    public int references() {
        return references;
    }

    @Override
    public void activate() {
        activations++;
    }

    @Override
    public void deactivate() {
        if (activations == 0) {
            throw new IllegalStateException("activation counter negative for " + this);
        }
        activations--;
    }

    @Override
    public boolean active() {
        return activations != 0;
    }

    @Override
    public void lock() {
        locks++;
    }

    @Override
    public void unlock() {
        if (locks == 0) {
            throw new IllegalStateException("lock counter negative for " + this);
        }
        locks--;
    }

    @Override
    public boolean locked() {
        return locks != 0;
    }
}
