package com.herzen.completion.batch;

import java.time.Instant;

public record AggregatorUpdatedEvent(String userId,
                                     String courseId,
                                     String blockKey,
                                     String blockType,
                                     double earned,
                                     double possible,
                                     Instant modified) {
    public double ratio() {
        return possible == 0.0 ? 1.0 : earned / possible;
    }
}
