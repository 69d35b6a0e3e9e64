package com.herzen.completion.batch;

import com.herzen.completion.staleness.StalenessModels.Scope;
import com.herzen.completion.staleness.StalenessModels.StaleRecord;

import java.util.List;

public class BatchModels {
    public record BatchRunReport(int claimed, int processed, int failed, int resolved) {
        public static BatchRunReport empty() {
            return new BatchRunReport(0, 0, 0, 0);
        }

        public BatchRunReport plus(BatchRunReport other) {
            return new BatchRunReport(claimed + other.claimed, processed + other.processed,
                    failed + other.failed, resolved + other.resolved);
        }

        public boolean allFailed() {
            return failed > 0 && processed == 0;
        }
    }

    record Unit(String userId, String courseId, Scope scope, List<StaleRecord> records) {
        static Unit of(String userId, String courseId, List<StaleRecord> records) {
            return new Unit(userId, courseId, Scope.merge(records), records);
        }

        List<Long> recordIds() {
            return records.stream().map(StaleRecord::id).toList();
        }
    }
}
