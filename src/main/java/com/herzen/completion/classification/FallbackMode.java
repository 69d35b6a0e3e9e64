package com.herzen.completion.classification;

import com.herzen.completion.domain.ContentModels.CompletionMode;

public enum FallbackMode {
    NONE,
    EXCLUDED,
    COMPLETABLE,
    AGGREGATOR,
    // aggregator with children, completable without
    STRUCTURAL;

    CompletionMode resolve(boolean hasChildren) {
        return switch (this) {
            case EXCLUDED -> CompletionMode.EXCLUDED;
            case COMPLETABLE -> CompletionMode.COMPLETABLE;
            case AGGREGATOR -> CompletionMode.AGGREGATOR;
            case STRUCTURAL -> hasChildren ? CompletionMode.AGGREGATOR : CompletionMode.COMPLETABLE;
            case NONE -> null;
        };
    }
}
