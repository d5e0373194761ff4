package com.hydrosentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Telemetry category a sensor publishes under.
 *
 * <p>
 * Each category carries its own physical bounds (see
 * {@link com.hydrosentinel.core.config.CategoryBounds}) and is normally
 * derived from the topic the reading arrived on.
 * </p>
 *
 * @since 1.0.0
 */
public enum SensorCategory {

    FLOW("flow"),
    QUALITY("quality"),
    WEATHER("weather");

    private final String topicSegment;

    SensorCategory(String topicSegment) {
        this.topicSegment = topicSegment;
    }

    /**
     * @return the lowercase name used in topic paths and configuration keys
     */
    public String getTopicSegment() {
        return topicSegment;
    }

    /**
     * Resolve a category from a free-form name ({@code "flow"}, {@code "FLOW"}).
     *
     * @param name category name, may be {@code null}
     * @return the category, or empty if the name is unknown
     */
    public static Optional<SensorCategory> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        for (SensorCategory category : values()) {
            if (category.topicSegment.equals(normalised)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a category from a topic such as {@code sensors/water/quality/ph-7}.
     *
     * <p>
     * The first topic level that names a category wins.
     * </p>
     *
     * @param topic MQTT-style topic, may be {@code null}
     * @return the category, or empty if no level matches
     */
    public static Optional<SensorCategory> fromTopic(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        for (String level : topic.split("/")) {
            Optional<SensorCategory> category = fromName(level);
            if (category.isPresent()) {
                return category;
            }
        }
        return Optional.empty();
    }
}
