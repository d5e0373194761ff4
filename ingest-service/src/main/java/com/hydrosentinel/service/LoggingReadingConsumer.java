package com.hydrosentinel.service;

import com.hydrosentinel.core.model.AnomalyVerdict;
import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.pipeline.ReadingConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every delivered reading to the {@code hydrosentinel.readings}
 * logger at DEBUG, standing in for the storage and optimization
 * collaborators.
 */
public class LoggingReadingConsumer implements ReadingConsumer {

    private static final Logger READINGS = LoggerFactory.getLogger("hydrosentinel.readings");

    @Override
    public void accept(CleanedReading reading, AnomalyVerdict verdict) {
        if (READINGS.isDebugEnabled()) {
            READINGS.debug("{} {} ts={} value={} z={} class={}",
                    reading.getCategory(), reading.getSensorId(), reading.getTimestamp(), reading.getValue(),
                    String.format("%.2f", verdict.getZScore()), verdict.getClassification());
        }
    }

    @Override
    public String getName() {
        return "log";
    }
}
