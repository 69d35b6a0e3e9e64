package com.herzen.completion.service;

import java.time.Instant;

public class CompletionModels {
    public enum CompletionStatus {
        NO_DATA,
        CURRENT,
        STALE,
        COMPUTED
    }

    public record CompletionView(String userId,
                                 String courseId,
                                 String blockId,
                                 double earned,
                                 double possible,
                                 double ratio,
                                 CompletionStatus status,
                                 Instant lastModified) {}
}
