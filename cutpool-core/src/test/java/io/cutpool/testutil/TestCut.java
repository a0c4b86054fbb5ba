package io.cutpool.testutil;

import io.cutpool.kernel.AbstractConVar;
import io.cutpool.kernel.ManagedObject;

import java.util.Arrays;

/**
 * Cut with integer coefficients; two cuts are equal when their coefficients
 * and right-hand side match. The hash key can be forced to provoke collisions.
 */
public final class TestCut extends AbstractConVar {

    private final String name;
    private final int[] coefficients;
    private final int rhs;
    private final Long forcedKey;
    private double rank;

    private TestCut(String name, int[] coefficients, int rhs, Long forcedKey, boolean dynamic) {
        super(dynamic, false);
        this.name = name;
        this.coefficients = coefficients.clone();
        this.rhs = rhs;
        this.forcedKey = forcedKey;
    }

    public static TestCut of(String name, int rhs, int... coefficients) {
        return new TestCut(name, coefficients, rhs, null, true);
    }

    public static TestCut withKey(String name, long key, int rhs, int... coefficients) {
        return new TestCut(name, coefficients, rhs, key, true);
    }

    public static TestCut nonDynamic(String name, int rhs, int... coefficients) {
        return new TestCut(name, coefficients, rhs, null, false);
    }

    public TestCut rank(double rank) {
        this.rank = rank;
        return this;
    }

    public String name() {
        return name;
    }

    /**
     * Slack-free violation by a point: {@code sum(a_i * x_i) - rhs}.
     */
    public double violation(double[] x) {
        double lhs = 0.0;
        for (int i = 0; i < coefficients.length && i < x.length; i++) {
            lhs += coefficients[i] * x[i];
        }
        return lhs - rhs;
    }

    @Override
    public long hashKey() {
        if (forcedKey != null) {
            return forcedKey;
        }
        return 31L * Arrays.hashCode(coefficients) + rhs;
    }

    @Override
    public boolean equal(ManagedObject other) {
        if (!(other instanceof TestCut cut)) {
            return false;
        }
        return rhs == cut.rhs && Arrays.equals(coefficients, cut.coefficients);
    }

    @Override
    public double rank() {
        return rank;
    }

    @Override
    public String toString() {
        return name;
    }
}
