package com.hydrosentinel.core.validation;

import com.hydrosentinel.core.config.CategoryBounds;
import com.hydrosentinel.core.config.PipelineConfig;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.RawReading;
import com.hydrosentinel.core.model.Rejection;
import com.hydrosentinel.core.model.RejectionReason;
import com.hydrosentinel.core.model.SensorCategory;
import com.hydrosentinel.core.stats.Sample;
import com.hydrosentinel.core.stats.StreamContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a {@link RawReading} into a {@link CleanedReading} or a
 * {@link Rejection}.
 *
 * <h3>Checks, in order</h3>
 * <p>
 * Stream-independent checks first, see {@link #precheck(RawReading)}:
 * </p>
 * <ol>
 * <li>payload parsed at all ({@link RejectionReason#MALFORMED})</li>
 * <li>sensor id present and well-formed ({@code MALFORMED}), and known when
 * an allow-list is configured ({@link RejectionReason#UNKNOWN_SENSOR})</li>
 * <li>timestamp present and parseable ({@code MALFORMED}), and not further
 * ahead of the clock than the allowed skew
 * ({@link RejectionReason#FUTURE_TIMESTAMP})</li>
 * <li>value, when present, numeric and finite ({@code MALFORMED}) and within
 * the category's physical bounds ({@link RejectionReason#OUT_OF_RANGE})</li>
 * </ol>
 * <p>
 * Then the checks against the stream's history:
 * </p>
 * <ol>
 * <li>timestamp not older than the stream's last accepted one beyond the
 * lateness tolerance ({@link RejectionReason#OUT_OF_ORDER}); slightly late
 * readings are clamped forward</li>
 * <li>a missing value is interpolated from the stream's window
 * ({@link RejectionReason#INSUFFICIENT_CONTEXT} without history)</li>
 * </ol>
 *
 * <p>
 * The validator never throws for bad input and keeps no state of its own;
 * stream history comes from the {@link StreamContext} the caller passes in.
 * </p>
 *
 * @since 1.0.0
 */
public class ReadingValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ReadingValidator.class);

    static final Pattern SENSOR_ID = Pattern.compile("[A-Za-z0-9_.:/\\-]{1,128}");

    private final Set<String> knownSensors;
    private final Map<SensorCategory, CategoryBounds> bounds = new EnumMap<>(SensorCategory.class);
    private final Duration latenessTolerance;
    private final Duration maxClockSkew;
    private final double interpolationPenalty;
    private final Clock clock;

    /**
     * @param config pipeline configuration; must not be {@code null}
     */
    public ReadingValidator(PipelineConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config pipeline configuration; must not be {@code null}
     * @param clock  reference for the future-timestamp check
     */
    public ReadingValidator(PipelineConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.knownSensors = new LinkedHashSet<>(config.getSensorIds());
        for (SensorCategory category : SensorCategory.values()) {
            bounds.put(category, config.boundsFor(category));
        }
        this.latenessTolerance = config.latenessTolerance();
        this.maxClockSkew = config.maxClockSkew();
        this.interpolationPenalty = config.getInterpolationPenalty();
    }

    /**
     * Run the checks that need no stream history. Callers use this to refuse
     * garbage before any per-stream state is created for it.
     *
     * @param raw the untrusted reading; must not be {@code null}
     * @return the rejection, or empty if the reading may proceed to
     *         {@link #validate(RawReading, StreamContext)}
     */
    public Optional<Rejection> precheck(RawReading raw) {
        Objects.requireNonNull(raw, "raw must not be null");

        if (raw.isMalformed()) {
            return Optional.of(rejection(raw, RejectionReason.MALFORMED,
                    raw.getMalformedReason().orElse("unparseable payload")));
        }

        String sensorId = raw.getSensorId();
        if (sensorId == null || !SENSOR_ID.matcher(sensorId).matches()) {
            return Optional.of(rejection(raw, RejectionReason.MALFORMED,
                    "missing or ill-formed sensor_id: " + sensorId));
        }
        if (!knownSensors.isEmpty() && !knownSensors.contains(sensorId)) {
            return Optional.of(rejection(raw, RejectionReason.UNKNOWN_SENSOR,
                    "sensor not configured: " + sensorId));
        }

        Optional<Instant> parsed = TimestampParser.parse(raw.getRawTimestamp());
        if (parsed.isEmpty()) {
            return Optional.of(rejection(raw, RejectionReason.MALFORMED,
                    "missing or unparseable timestamp: " + raw.getRawTimestamp()));
        }
        Instant latest = clock.instant().plus(maxClockSkew);
        if (parsed.get().isAfter(latest)) {
            return Optional.of(rejection(raw, RejectionReason.FUTURE_TIMESTAMP,
                    "timestamp " + parsed.get() + " is ahead of the latest accepted " + latest));
        }

        Object rawValue = raw.getRawValue();
        if (rawValue != null) {
            Optional<Double> numeric = toDouble(rawValue);
            if (numeric.isEmpty()) {
                return Optional.of(rejection(raw, RejectionReason.MALFORMED,
                        "value is not a finite number: " + rawValue));
            }
            CategoryBounds range = bounds.get(raw.getCategory());
            if (!range.contains(numeric.get())) {
                return Optional.of(rejection(raw, RejectionReason.OUT_OF_RANGE,
                        "value " + numeric.get() + " outside " + raw.getCategory() + " bounds " + range));
            }
        }
        return Optional.empty();
    }

    /**
     * Validate a reading against its stream's history. Runs
     * {@link #precheck(RawReading)} first.
     *
     * @param raw     the untrusted reading; must not be {@code null}
     * @param context the stream's history; use {@link StreamContext#empty()}
     *                for a new stream
     * @return the cleaned reading or the rejection
     */
    public ValidationResult validate(RawReading raw, StreamContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Optional<Rejection> early = precheck(raw);
        if (early.isPresent()) {
            return ValidationResult.rejected(early.get());
        }

        Instant timestamp = TimestampParser.parse(raw.getRawTimestamp()).orElseThrow();
        boolean adjusted = false;
        Optional<Instant> last = context.lastAcceptedTimestamp();
        if (last.isPresent() && timestamp.isBefore(last.get())) {
            Duration lateness = Duration.between(timestamp, last.get());
            if (lateness.compareTo(latenessTolerance) > 0) {
                return ValidationResult.rejected(rejection(raw, RejectionReason.OUT_OF_ORDER,
                        "timestamp " + timestamp + " is " + lateness.toMillis() + "ms behind " + last.get()));
            }
            timestamp = last.get();
            adjusted = true;
        }

        double value;
        boolean interpolated = false;
        Object rawValue = raw.getRawValue();
        if (rawValue == null) {
            Optional<Double> estimate = interpolate(context, timestamp);
            if (estimate.isEmpty()) {
                return ValidationResult.rejected(rejection(raw, RejectionReason.INSUFFICIENT_CONTEXT,
                        "value missing and no history on stream " + raw.streamId()));
            }
            value = bounds.get(raw.getCategory()).clamp(estimate.get());
            interpolated = true;
        } else {
            value = toDouble(rawValue).orElseThrow();
        }

        double confidence = raw.getReportedQuality()
                .filter(Double::isFinite)
                .map(q -> Math.max(0.0, Math.min(1.0, q)))
                .orElse(1.0);
        if (interpolated) {
            confidence *= interpolationPenalty;
        }

        return ValidationResult.accepted(CleanedReading.builder()
                .sensorId(raw.getSensorId())
                .category(raw.getCategory())
                .timestamp(timestamp)
                .value(value)
                .interpolated(interpolated)
                .timestampAdjusted(adjusted)
                .confidence(confidence)
                .metadata(raw.getMetadata())
                .receivedNanos(raw.getReceivedNanos())
                .build());
    }

    /**
     * Linear interpolation at {@code at} through the two newest samples;
     * carries the newest value forward when only one sample exists.
     */
    static Optional<Double> interpolate(StreamContext context, Instant at) {
        Optional<Sample> newest = context.recentSample(0);
        if (newest.isEmpty()) {
            return Optional.empty();
        }
        Optional<Sample> previous = context.recentSample(1);
        if (previous.isEmpty()) {
            return Optional.of(newest.get().getValue());
        }
        Sample s2 = newest.get();
        Sample s1 = previous.get();
        double span = seconds(s2.getTimestamp()) - seconds(s1.getTimestamp());
        if (span <= 0) {
            return Optional.of(s2.getValue());
        }
        double offset = seconds(at) - seconds(s2.getTimestamp());
        double estimate = s2.getValue() + (s2.getValue() - s1.getValue()) / span * offset;
        return Double.isFinite(estimate) ? Optional.of(estimate) : Optional.of(s2.getValue());
    }

    // fractional epoch seconds; Duration#toNanos overflows beyond ~292 years
    private static double seconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }

    static Optional<Double> toDouble(Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private static Rejection rejection(RawReading raw, RejectionReason reason, String detail) {
        LOG.debug("Rejected reading from sensor [{}]: {} ({})", raw.getSensorId(), reason, detail);
        return new Rejection(raw, reason, detail);
    }
}
