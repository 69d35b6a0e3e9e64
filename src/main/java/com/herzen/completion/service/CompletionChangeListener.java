package com.herzen.completion.service;

import com.herzen.completion.source.BlockCompletionChangedEvent;
import com.herzen.completion.staleness.StalenessTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class CompletionChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CompletionChangeListener.class);

    private final StalenessTracker stalenessTracker;

    public CompletionChangeListener(StalenessTracker stalenessTracker) {
        this.stalenessTracker = stalenessTracker;
    }

    @EventListener
    public void onCompletionChanged(BlockCompletionChangedEvent event) {
        if (event.userId() == null || event.courseId() == null) {
            log.warn("Ignoring completion change without user or course: {}", event);
            return;
        }
        log.info("Marking aggregators stale for {}/{}. Updated block: {}", event.userId(), event.courseId(), event.blockKey());
        stalenessTracker.markStale(event.userId(), event.courseId(), event.blockKey());
    }
}
