package com.hydrosentinel.core.config;

import com.hydrosentinel.core.model.SensorCategory;

import java.util.Objects;

/**
 * Inclusive physical bounds for the values of one {@link SensorCategory}.
 *
 * <pre>
 * bounds:
 *   flow:
 *     min: 0
 *     max: 10000
 * </pre>
 *
 * @since 1.0.0
 */
public class CategoryBounds {

    private double min;
    private double max;

    /** No-arg constructor required by SnakeYAML. */
    public CategoryBounds() {
    }

    public CategoryBounds(double min, double max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Built-in bounds used when the configuration does not override a
     * category. Flow rates are never negative.
     *
     * @param category sensor category; must not be {@code null}
     * @return default bounds for the category
     */
    public static CategoryBounds defaultFor(SensorCategory category) {
        Objects.requireNonNull(category, "category must not be null");
        return switch (category) {
            case FLOW -> new CategoryBounds(0, 10_000);
            case QUALITY -> new CategoryBounds(0, 14_000);
            case WEATHER -> new CategoryBounds(-100, 10_000);
        };
    }

    /**
     * @param value candidate value
     * @return {@code true} if {@code min <= value <= max}
     */
    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /**
     * @param value candidate value
     * @return the value clamped into {@code [min, max]}
     */
    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public double getMin() {
        return min;
    }

    public void setMin(double min) {
        this.min = min;
    }

    public double getMax() {
        return max;
    }

    public void setMax(double max) {
        this.max = max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
