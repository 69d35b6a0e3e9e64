package com.herzen.completion.service;

import com.herzen.completion.config.AggregatorProperties;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.source.ContentTreeProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ContentTreeCache {
    private final ContentTreeProvider provider;
    private final AggregatorProperties properties;
    private final Clock clock;
    private final Map<String, Entry> cache = new ConcurrentHashMap<>();

    public ContentTreeCache(ContentTreeProvider provider, AggregatorProperties properties, Clock clock) {
        this.provider = provider;
        this.properties = properties;
        this.clock = clock;
    }

    public ContentTree get(String courseId) {
        Instant now = clock.instant();
        Entry cached = cache.get(courseId);
        if (cached != null && cached.expires().isAfter(now)) return cached.tree();

        ContentTree tree = provider.getTree(courseId);
        cache.put(courseId, new Entry(tree, now.plus(properties.getTreeCacheTtl())));
        return tree;
    }

    public void invalidate(String courseId) {
        cache.remove(courseId);
    }

    public void invalidateAll() {
        cache.clear();
    }

    private record Entry(ContentTree tree, Instant expires) {}
}
