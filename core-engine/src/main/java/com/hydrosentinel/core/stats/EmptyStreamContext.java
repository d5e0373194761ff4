package com.hydrosentinel.core.stats;

import java.time.Instant;
import java.util.Optional;

final class EmptyStreamContext implements StreamContext {

    static final EmptyStreamContext INSTANCE = new EmptyStreamContext();

    private EmptyStreamContext() {
    }

    @Override
    public int sampleCount() {
        return 0;
    }

    @Override
    public Optional<Sample> recentSample(int age) {
        return Optional.empty();
    }

    @Override
    public Optional<Instant> lastAcceptedTimestamp() {
        return Optional.empty();
    }
}
