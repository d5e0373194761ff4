package com.hydrosentinel.core.model;

/**
 * Why the validator refused a reading.
 *
 * @since 1.0.0
 */
public enum RejectionReason {

    /** Unparseable payload, missing required field or non-numeric value. */
    MALFORMED,

    /** Value missing and no window history to reconstruct it from. */
    INSUFFICIENT_CONTEXT,

    /** Value outside the physical bounds of the sensor category. */
    OUT_OF_RANGE,

    /** Timestamp earlier than the stream's last accepted timestamp beyond the lateness tolerance. */
    OUT_OF_ORDER,

    /** Sensor id not in the configured allow-list. */
    UNKNOWN_SENSOR,

    /** Timestamp further ahead of the local clock than the allowed skew. */
    FUTURE_TIMESTAMP
}
