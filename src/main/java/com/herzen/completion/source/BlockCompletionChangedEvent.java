package com.herzen.completion.source;

public record BlockCompletionChangedEvent(String userId, String courseId, String blockKey) {}
