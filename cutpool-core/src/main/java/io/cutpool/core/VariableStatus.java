package io.cutpool.core;

/**
 * Fix/set status of a variable in a subproblem.
 * <p>
 * A variable that is <i>fixed</i> keeps its value in the whole remaining
 * subtree; a variable that is <i>set</i> keeps it only in the subproblem and
 * its descendants reached by branching. The bound statuses carry no value,
 * {@link Status#SET} and {@link Status#FIXED} always do.
 * <p>
 * Not thread-safe; one instance belongs to one variable of one subproblem.
 */
public final class VariableStatus {

    public enum Status {
        FREE,
        SET_TO_LOWER_BOUND,
        SET,
        SET_TO_UPPER_BOUND,
        FIXED_TO_LOWER_BOUND,
        FIXED,
        FIXED_TO_UPPER_BOUND;

        boolean hasValue() {
            return this == SET || this == FIXED;
        }

        boolean lowerBound() {
            return this == SET_TO_LOWER_BOUND || this == FIXED_TO_LOWER_BOUND;
        }

        boolean upperBound() {
            return this == SET_TO_UPPER_BOUND || this == FIXED_TO_UPPER_BOUND;
        }
    }

    private final double eps;
    private Status status;
    private double value;

    /**
     * Create a free status.
     *
     * @param eps tolerance used when comparing values
     */
    public VariableStatus(double eps) {
        this(eps, Status.FREE);
    }

    /**
     * Create a status without value.
     *
     * @throws IllegalArgumentException for {@link Status#SET} or {@link Status#FIXED}
     */
    public VariableStatus(double eps, Status status) {
        if (eps < 0.0) {
            throw new IllegalArgumentException("eps must be non-negative: " + eps);
        }
        requireValueless(status);
        this.eps = eps;
        this.status = status;
        this.value = 0.0;
    }

    /**
     * Create a status with value.
     *
     * @throws IllegalArgumentException unless status is {@link Status#SET} or {@link Status#FIXED}
     */
    public VariableStatus(double eps, Status status, double value) {
        if (eps < 0.0) {
            throw new IllegalArgumentException("eps must be non-negative: " + eps);
        }
        requireValued(status);
        this.eps = eps;
        this.status = status;
        this.value = value;
    }

    /**
     * Create a free status compared with the configured {@code EqualityEps}.
     */
    public static VariableStatus free(CutPoolConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        return new VariableStatus(configuration.equalityEps());
    }

    /**
     * Copy constructor.
     */
    public VariableStatus(VariableStatus other) {
        this.eps = other.eps;
        this.status = other.status;
        this.value = other.value;
    }

    public Status status() {
        return status;
    }

    /**
     * Value of a {@link Status#SET} or {@link Status#FIXED} variable; 0 otherwise.
     */
    public double value() {
        return value;
    }

    public void status(Status status) {
        requireValueless(status);
        this.status = status;
        this.value = 0.0;
    }

    public void status(Status status, double value) {
        requireValued(status);
        this.status = status;
        this.value = value;
    }

    public void status(VariableStatus other) {
        this.status = other.status;
        this.value = other.value;
    }

    public boolean fixed() {
        return status == Status.FIXED_TO_LOWER_BOUND
                || status == Status.FIXED
                || status == Status.FIXED_TO_UPPER_BOUND;
    }

    public boolean set() {
        return status == Status.SET_TO_LOWER_BOUND
                || status == Status.SET
                || status == Status.SET_TO_UPPER_BOUND;
    }

    public boolean fixedOrSet() {
        return status != Status.FREE;
    }

    public boolean contradiction(VariableStatus other) {
        return contradiction(other.status, other.value);
    }

    /**
     * Check whether fixing or setting to {@code other} would contradict this status.
     * Two statuses contradict if they refer to different bounds or values:
     * a bound status contradicts the opposite bound and every valued status,
     * and two valued statuses contradict if their values differ by more than
     * the tolerance. Fixed and set to the same bound or value agree. A free
     * status on either side never contradicts.
     */
    public boolean contradiction(Status other, double otherValue) {
        if (status == Status.FREE || other == Status.FREE) {
            return false;
        }
        if (status.lowerBound()) {
            return !other.lowerBound();
        }
        if (status.upperBound()) {
            return !other.upperBound();
        }
        if (other.hasValue()) {
            return Math.abs(value - otherValue) > eps;
        }
        return true;
    }

    /**
     * Apply a valueless status, escalating conflicts.
     *
     * @throws ContradictionException if the request contradicts the current status
     */
    public void apply(Status other) {
        requireValueless(other);
        if (contradiction(other, 0.0)) {
            throw new ContradictionException("Cannot change " + this + " to " + other);
        }
        if (other != Status.FREE) {
            status(other);
        }
    }

    /**
     * Apply a valued status, escalating conflicts.
     *
     * @throws ContradictionException if the request contradicts the current status
     */
    public void apply(Status other, double otherValue) {
        requireValued(other);
        if (contradiction(other, otherValue)) {
            throw new ContradictionException("Cannot change " + this + " to " + other + " " + otherValue);
        }
        status(other, otherValue);
    }

    private static void requireValueless(Status status) {
        if (status == null) {
            throw new IllegalArgumentException("status required");
        }
        if (status.hasValue()) {
            throw new IllegalArgumentException("value to set/fix missing for " + status);
        }
    }

    private static void requireValued(Status status) {
        if (status == null) {
            throw new IllegalArgumentException("status required");
        }
        if (!status.hasValue()) {
            throw new IllegalArgumentException("status " + status + " takes no value");
        }
    }

    @Override
    public String toString() {
        return status.hasValue() ? status + " " + value : status.toString();
    }
}
