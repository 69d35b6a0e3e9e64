package com.herzen.completion.staleness;

import java.time.Instant;
import java.util.Collection;

public class StalenessModels {
    public record StaleRecord(long id,
                              String userId,
                              String courseId,
                              String blockKey,
                              boolean force,
                              String claimToken,
                              Instant claimExpires,
                              boolean resolved,
                              Instant created,
                              Instant modified) {
        public boolean wholeCourse() {
            return blockKey == null;
        }

        public boolean claimed(Instant now) {
            return claimToken != null && claimExpires != null && claimExpires.isAfter(now);
        }
    }

    public record Scope(String blockKey, boolean force) {
        public static Scope merge(Collection<StaleRecord> records) {
            String block = null;
            boolean first = true;
            boolean force = false;
            for (StaleRecord r : records) {
                if (first) {
                    block = r.blockKey();
                    first = false;
                } else if (block != null && !block.equals(r.blockKey())) {
                    block = null;
                }
                force |= r.force();
            }
            return new Scope(block, force);
        }

        public boolean wholeCourse() {
            return blockKey == null;
        }
    }
}
