package com.hydrosentinel.core.pipeline;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.Rejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link AuditSink} writing to the {@code hydrosentinel.audit}
 * logger, so the audit trail can be routed to its own appender.
 *
 * @since 1.0.0
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("hydrosentinel.audit");

    @Override
    public void quarantined(CleanedReading reading, AnomalyVerdict verdict) {
        AUDIT.info("QUARANTINED sensor={} ts={} value={} quality={} z={}",
                reading.getSensorId(),
                reading.getTimestamp(),
                reading.getValue(),
                String.format("%.3f", verdict.getQualityScore()),
                String.format("%.3f", verdict.getZScore()));
    }

    @Override
    public void rejected(Rejection rejection) {
        AUDIT.warn("REJECTED sensor={} topic={} reason={} detail={}",
                rejection.getReading().getSensorId(),
                rejection.getReading().getTopic(),
                rejection.getReason(),
                rejection.getDetail());
    }
}
