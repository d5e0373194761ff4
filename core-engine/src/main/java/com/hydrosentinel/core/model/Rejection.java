package com.hydrosentinel.core.model;

import java.util.Objects;

/**
 * Record of a reading the validator refused.
 *
 * @since 1.0.0
 */
public final class Rejection {

    private final RawReading reading;
    private final RejectionReason reason;
    private final String detail;

    public Rejection(RawReading reading, RejectionReason reason, String detail) {
        this.reading = Objects.requireNonNull(reading, "reading must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.detail = detail != null ? detail : reason.name();
    }

    public RawReading getReading() {
        return reading;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "Rejection{" +
                "reason=" + reason +
                ", detail='" + detail + '\'' +
                ", sensorId='" + reading.getSensorId() + '\'' +
                '}';
    }
}
