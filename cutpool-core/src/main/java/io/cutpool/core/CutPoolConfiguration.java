package io.cutpool.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Immutable configuration for pools, staging buffers and active sets.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * CutPoolConfiguration config = CutPoolConfiguration.builder()
 *     .poolSize(5000)
 *     .autoRealloc(false)
 *     .maxConBuffered(200)
 *     .build();
 * </pre>
 * <p>
 * A configuration can also be read from a properties file whose keys are
 * the parameter names of the solver ({@code PoolSize}, {@code MaxConAdd},
 * {@code ConElimAge}, ...). Keys that are absent keep their defaults.
 * <p>
 * All configuration is immutable once built.
 */
public final class CutPoolConfiguration {

    public static final String DEFAULT_RESOURCE = "cutpool.properties";

    // Pool sizing
    private final int poolSize;
    private final boolean autoRealloc;
    private final double growthFactor;
    private final boolean evictNonActiveOnFull;

    // Buffering and admission per round
    private final int maxConAdd;
    private final int maxConBuffered;
    private final int maxVarAdd;
    private final int maxVarBuffered;
    private final double minAbsViolation;

    // Elimination of redundant active items
    private final int conElimAge;
    private final int varElimAge;
    private final double conElimEps;

    // Active sets
    private final double activeGrowthFactor;

    // Tolerance for comparing fixed/set values
    private final double equalityEps;

    private CutPoolConfiguration(Builder builder) {
        this.poolSize = builder.poolSize;
        this.autoRealloc = builder.autoRealloc;
        this.growthFactor = builder.growthFactor;
        this.evictNonActiveOnFull = builder.evictNonActiveOnFull;
        this.maxConAdd = builder.maxConAdd;
        this.maxConBuffered = builder.maxConBuffered;
        this.maxVarAdd = builder.maxVarAdd;
        this.maxVarBuffered = builder.maxVarBuffered;
        this.minAbsViolation = builder.minAbsViolation;
        this.conElimAge = builder.conElimAge;
        this.varElimAge = builder.varElimAge;
        this.conElimEps = builder.conElimEps;
        this.activeGrowthFactor = builder.activeGrowthFactor;
        this.equalityEps = builder.equalityEps;
    }

    /**
     * Create a new builder for CutPoolConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every parameter at its default.
     */
    public static CutPoolConfiguration defaults() {
        return new Builder().build();
    }

    /**
     * Read a configuration from properties.
     *
     * @param properties parameter names mapped to values
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static CutPoolConfiguration fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties required");
        }
        Builder builder = builder();
        ParameterReader reader = new ParameterReader(properties);
        builder.poolSize(reader.intValue("PoolSize", builder.poolSize, 1, Integer.MAX_VALUE));
        builder.autoRealloc(reader.booleanValue("AutoRealloc", builder.autoRealloc));
        builder.growthFactor(reader.doubleValue("GrowthFactor", builder.growthFactor, 1.0, 100.0));
        builder.evictNonActiveOnFull(reader.booleanValue("EvictNonActiveOnFull", builder.evictNonActiveOnFull));
        builder.maxConAdd(reader.intValue("MaxConAdd", builder.maxConAdd, 0, Integer.MAX_VALUE));
        builder.maxConBuffered(reader.intValue("MaxConBuffered", builder.maxConBuffered, 0, Integer.MAX_VALUE));
        builder.maxVarAdd(reader.intValue("MaxVarAdd", builder.maxVarAdd, 0, Integer.MAX_VALUE));
        builder.maxVarBuffered(reader.intValue("MaxVarBuffered", builder.maxVarBuffered, 0, Integer.MAX_VALUE));
        builder.minAbsViolation(reader.doubleValue("MinAbsViolation", builder.minAbsViolation, 0.0, Double.MAX_VALUE));
        builder.conElimAge(reader.intValue("ConElimAge", builder.conElimAge, 1, Integer.MAX_VALUE));
        builder.varElimAge(reader.intValue("VarElimAge", builder.varElimAge, 1, Integer.MAX_VALUE));
        builder.conElimEps(reader.doubleValue("ConElimEps", builder.conElimEps, 0.0, Double.MAX_VALUE));
        builder.activeGrowthFactor(reader.doubleValue("ActiveGrowthFactor", builder.activeGrowthFactor, 1.0, 100.0));
        builder.equalityEps(reader.doubleValue("EqualityEps", builder.equalityEps, 0.0, 1.0));
        return builder.build();
    }

    /**
     * Read a configuration from a classpath resource.
     *
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return the configuration
     * @throws CutPoolException if the resource is missing or unreadable
     */
    public static CutPoolConfiguration load(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource required");
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = CutPoolConfiguration.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CutPoolException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new CutPoolException("Cannot read configuration resource " + resource, e);
        }
    }

    /**
     * Maximal number of items a pool holds without reallocation.
     */
    public int poolSize() {
        return poolSize;
    }

    /**
     * Check if a full pool grows automatically.
     *
     * @return true if a full pool is reallocated (default: true)
     */
    public boolean autoRealloc() {
        return autoRealloc;
    }

    /**
     * Factor applied to the pool capacity on automatic reallocation.
     */
    public double growthFactor() {
        return growthFactor;
    }

    /**
     * Check if a full, non-growing pool may hard-delete items that are
     * neither active nor locked to make room.
     *
     * @return true if eviction is enabled (default: false)
     */
    public boolean evictNonActiveOnFull() {
        return evictNonActiveOnFull;
    }

    /**
     * Maximal number of constraints added to the active set per round.
     */
    public int maxConAdd() {
        return maxConAdd;
    }

    /**
     * Capacity of the constraint staging buffer.
     */
    public int maxConBuffered() {
        return maxConBuffered;
    }

    /**
     * Maximal number of variables added to the active set per round.
     */
    public int maxVarAdd() {
        return maxVarAdd;
    }

    /**
     * Capacity of the variable staging buffer.
     */
    public int maxVarBuffered() {
        return maxVarBuffered;
    }

    /**
     * Minimal absolute violation for an item to be separated.
     */
    public double minAbsViolation() {
        return minAbsViolation;
    }

    /**
     * Number of consecutive non-binding rounds before a constraint is eliminated.
     */
    public int conElimAge() {
        return conElimAge;
    }

    /**
     * Number of consecutive non-binding rounds before a variable is eliminated.
     */
    public int varElimAge() {
        return varElimAge;
    }

    /**
     * Slack tolerance above which a constraint counts as non-binding.
     */
    public double conElimEps() {
        return conElimEps;
    }

    /**
     * Factor applied to an active set's capacity when an insert overflows it.
     */
    public double activeGrowthFactor() {
        return activeGrowthFactor;
    }

    /**
     * Tolerance used when comparing fixed or set variable values.
     */
    public double equalityEps() {
        return equalityEps;
    }

    @Override
    public String toString() {
        return "CutPoolConfiguration{"
                + "poolSize=" + poolSize
                + ", autoRealloc=" + autoRealloc
                + ", growthFactor=" + growthFactor
                + ", evictNonActiveOnFull=" + evictNonActiveOnFull
                + ", maxConAdd=" + maxConAdd
                + ", maxConBuffered=" + maxConBuffered
                + ", maxVarAdd=" + maxVarAdd
                + ", maxVarBuffered=" + maxVarBuffered
                + ", minAbsViolation=" + minAbsViolation
                + ", conElimAge=" + conElimAge
                + ", varElimAge=" + varElimAge
                + ", conElimEps=" + conElimEps
                + ", activeGrowthFactor=" + activeGrowthFactor
                + ", equalityEps=" + equalityEps
                + '}';
    }

    /**
     * Builder for CutPoolConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int poolSize = 1000;
        private boolean autoRealloc = true;
        private double growthFactor = 1.1;
        private boolean evictNonActiveOnFull = false;
        private int maxConAdd = 100;
        private int maxConBuffered = 100;
        private int maxVarAdd = 100;
        private int maxVarBuffered = 100;
        private double minAbsViolation = 0.001;
        private int conElimAge = 1;
        private int varElimAge = 1;
        private double conElimEps = 0.001;
        private double activeGrowthFactor = 1.5;
        private double equalityEps = 1.0e-9;

        private Builder() {
        }

        /**
         * Set the number of items a pool holds without reallocation.
         *
         * @param poolSize the pool size (must be positive)
         * @return this builder for method chaining
         */
        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Enable or disable automatic pool reallocation.
         *
         * @param autoRealloc true to grow full pools (default: true)
         * @return this builder for method chaining
         */
        public Builder autoRealloc(boolean autoRealloc) {
            this.autoRealloc = autoRealloc;
            return this;
        }

        /**
         * Set the pool growth factor.
         *
         * @param growthFactor factor greater than 1
         * @return this builder for method chaining
         */
        public Builder growthFactor(double growthFactor) {
            this.growthFactor = growthFactor;
            return this;
        }

        /**
         * Enable or disable eviction of non-active items from full pools.
         *
         * @param evictNonActiveOnFull true to evict (default: false)
         * @return this builder for method chaining
         */
        public Builder evictNonActiveOnFull(boolean evictNonActiveOnFull) {
            this.evictNonActiveOnFull = evictNonActiveOnFull;
            return this;
        }

        public Builder maxConAdd(int maxConAdd) {
            this.maxConAdd = maxConAdd;
            return this;
        }

        public Builder maxConBuffered(int maxConBuffered) {
            this.maxConBuffered = maxConBuffered;
            return this;
        }

        public Builder maxVarAdd(int maxVarAdd) {
            this.maxVarAdd = maxVarAdd;
            return this;
        }

        public Builder maxVarBuffered(int maxVarBuffered) {
            this.maxVarBuffered = maxVarBuffered;
            return this;
        }

        public Builder minAbsViolation(double minAbsViolation) {
            this.minAbsViolation = minAbsViolation;
            return this;
        }

        public Builder conElimAge(int conElimAge) {
            this.conElimAge = conElimAge;
            return this;
        }

        public Builder varElimAge(int varElimAge) {
            this.varElimAge = varElimAge;
            return this;
        }

        public Builder conElimEps(double conElimEps) {
            this.conElimEps = conElimEps;
            return this;
        }

        /**
         * Set the factor by which an overflowing active set grows.
         *
         * @param activeGrowthFactor factor greater than 1 (default: 1.5)
         * @return this builder for method chaining
         */
        public Builder activeGrowthFactor(double activeGrowthFactor) {
            this.activeGrowthFactor = activeGrowthFactor;
            return this;
        }

        public Builder equalityEps(double equalityEps) {
            this.equalityEps = equalityEps;
            return this;
        }

        /**
         * Build the immutable CutPoolConfiguration.
         *
         * @return a new CutPoolConfiguration instance
         * @throws IllegalArgumentException if a parameter is out of range
         */
        public CutPoolConfiguration build() {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
            }
            if (!(growthFactor > 1.0)) {
                throw new IllegalArgumentException("growthFactor must be greater than 1: " + growthFactor);
            }
            if (!(activeGrowthFactor > 1.0)) {
                throw new IllegalArgumentException("activeGrowthFactor must be greater than 1: " + activeGrowthFactor);
            }
            if (maxConAdd < 0 || maxConBuffered < 0 || maxVarAdd < 0 || maxVarBuffered < 0) {
                throw new IllegalArgumentException("add/buffer limits must be non-negative");
            }
            if (conElimAge < 1 || varElimAge < 1) {
                throw new IllegalArgumentException("elimination ages must be at least 1");
            }
            if (minAbsViolation < 0.0 || conElimEps < 0.0 || equalityEps < 0.0) {
                throw new IllegalArgumentException("tolerances must be non-negative");
            }
            return new CutPoolConfiguration(this);
        }
    }

    private static final class ParameterReader {
        private final Properties properties;

        private ParameterReader(Properties properties) {
            this.properties = properties;
        }

        int intValue(String key, int fallback, int min, int max) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            int value;
            try {
                value = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " is not an integer: " + raw, e);
            }
            if (value < min || value > max) {
                throw new IllegalArgumentException(
                        "Parameter " + key + " out of range [" + min + ", " + max + "]: " + value);
            }
            return value;
        }

        double doubleValue(String key, double fallback, double min, double max) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            double value;
            try {
                value = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " is not a number: " + raw, e);
            }
            if (Double.isNaN(value) || value < min || value > max) {
                throw new IllegalArgumentException(
                        "Parameter " + key + " out of range [" + min + ", " + max + "]: " + value);
            }
            return value;
        }

        boolean booleanValue(String key, boolean fallback) {
            String raw = raw(key);
            if (raw == null) {
                return fallback;
            }
            if ("true".equalsIgnoreCase(raw)) {
                return true;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return false;
            }
            throw new IllegalArgumentException("Parameter " + key + " is not a boolean: " + raw);
        }

        private String raw(String key) {
            String value = properties.getProperty(key);
            return value == null ? null : value.trim();
        }
    }
}
