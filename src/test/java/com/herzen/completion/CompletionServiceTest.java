package com.herzen.completion;

import com.herzen.completion.aggregation.AggregationModels.AggregateResult;
import com.herzen.completion.batch.BatchCoordinator;
import com.herzen.completion.config.AggregatorProperties;
import com.herzen.completion.domain.ContentTree;
import com.herzen.completion.exception.BlockNotFoundException;
import com.herzen.completion.exception.CourseNotFoundException;
import com.herzen.completion.repository.AggregatorJdbcRepository;
import com.herzen.completion.repository.BlockCompletionJdbcRepository;
import com.herzen.completion.repository.ContentTreeJdbcRepository;
import com.herzen.completion.service.CompletionModels.CompletionStatus;
import com.herzen.completion.service.CompletionModels.CompletionView;
import com.herzen.completion.service.CompletionService;
import com.herzen.completion.service.ContentTreeCache;
import com.herzen.completion.source.BlockCompletionChangedEvent;
import com.herzen.completion.staleness.StalenessTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class CompletionServiceTest {
    private static final double EPS = 1e-9;

    @Autowired
    private CompletionService completionService;

    @Autowired
    private BatchCoordinator coordinator;

    @Autowired
    private StalenessTracker tracker;

    @Autowired
    private ContentTreeJdbcRepository treeRepository;

    @Autowired
    private BlockCompletionJdbcRepository completionRepository;

    @Autowired
    private AggregatorJdbcRepository aggregatorRepository;

    @Autowired
    private ContentTreeCache treeCache;

    @Autowired
    private AggregatorProperties properties;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void reset() {
        jdbcTemplate.update("DELETE FROM stale_completions");
        jdbcTemplate.update("DELETE FROM aggregators");
        jdbcTemplate.update("DELETE FROM block_completions");
        jdbcTemplate.update("DELETE FROM course_blocks");
        clock.set(TestClockConfiguration.START);
        treeCache.invalidateAll();
        treeRepository.replaceCourseBlocks(TreeBuilder.sampleCourse("course-1"));
    }

    @AfterEach
    void restoreMode() {
        properties.setAsyncAggregation(false);
    }

    @Test
    void reportsNoDataBeforeAnythingIsAggregated() {
        CompletionView view = completionService.getCourseCompletion("alice", "course-1");

        assertEquals(CompletionStatus.NO_DATA, view.status());
        assertEquals("course", view.blockId());
        assertEquals(0.0, view.ratio(), EPS);
        assertNull(view.lastModified());
    }

    @Test
    void servesStoredValueOnceBatchHasRun() {
        completionRepository.save("alice", "course-1", "html-1", 1.0, clock.instant());
        tracker.markStale("alice", "course-1", "html-1");
        coordinator.runOnce(100, Duration.ofMinutes(30));

        CompletionView course = completionService.getCourseCompletion("alice", "course-1");
        CompletionView chapter = completionService.getBlockCompletion("alice", "course-1", "chapter-1");

        assertEquals(CompletionStatus.CURRENT, course.status());
        assertEquals(0.2, course.ratio(), EPS);
        assertEquals(TestClockConfiguration.START, course.lastModified());
        assertEquals(CompletionStatus.CURRENT, chapter.status());
        assertEquals(1.0, chapter.earned(), EPS);
        assertEquals(2.0, chapter.possible(), EPS);
    }

    @Test
    void asyncModeFlagsPendingChangesInsteadOfComputing() {
        properties.setAsyncAggregation(true);
        ContentTree tree = TreeBuilder.sampleCourse("course-1");
        aggregatorRepository.upsertAll("alice", "course-1", tree,
                Map.of("course", new AggregateResult("course", 1.0, 5.0)), clock.instant());
        completionRepository.save("alice", "course-1", "html-2", 1.0, clock.instant());
        tracker.markStale("alice", "course-1", "html-2");

        CompletionView view = completionService.getCourseCompletion("alice", "course-1");

        assertEquals(CompletionStatus.STALE, view.status());
        assertEquals(1.0, view.earned(), EPS);
        assertTrue(tracker.isStale("alice", "course-1"));
    }

    @Test
    void syncModeComputesPendingChangesInlineWithoutStoring() {
        completionRepository.save("alice", "course-1", "video-1", 1.0, clock.instant());
        completionRepository.save("alice", "course-1", "problem-1", 0.5, clock.instant());
        tracker.markStale("alice", "course-1", "problem-1");

        CompletionView course = completionService.getCourseCompletion("alice", "course-1");
        CompletionView seq = completionService.getBlockCompletion("alice", "course-1", "seq-1");

        assertEquals(CompletionStatus.COMPUTED, course.status());
        assertEquals(1.5, course.earned(), EPS);
        assertEquals(5.0, course.possible(), EPS);
        assertEquals(0.3, course.ratio(), EPS);
        assertEquals(0.5, seq.ratio(), EPS);
        assertTrue(aggregatorRepository.findForUser("alice", "course-1").isEmpty());
        assertTrue(tracker.isStale("alice", "course-1"));
    }

    @Test
    void unknownBlockOrCourseIsRejected() {
        assertThrows(BlockNotFoundException.class,
                () -> completionService.getBlockCompletion("alice", "course-1", "no-such-block"));
        assertThrows(CourseNotFoundException.class,
                () -> completionService.getCourseCompletion("alice", "course-missing"));
    }

    @Test
    void completionChangeEventMarksPairStale() {
        eventPublisher.publishEvent(new BlockCompletionChangedEvent("dave", "course-1", "video-2"));

        assertTrue(tracker.isStale("dave", "course-1"));
        assertEquals("video-2", tracker.findPending("dave", "course-1").get(0).blockKey());
    }

    @Test
    void reaggregationMarksEveryKnownUserOnce() {
        completionRepository.save("alice", "course-1", "html-1", 1.0, clock.instant());
        aggregatorRepository.upsertAll("bob", "course-1", TreeBuilder.sampleCourse("course-1"),
                Map.of("course", new AggregateResult("course", 0.0, 5.0)), clock.instant());

        assertEquals(2, completionService.triggerReaggregation("course-1", List.of()));
        assertEquals(0, completionService.triggerReaggregation("course-1", null));
        assertTrue(tracker.findPending("alice", "course-1").get(0).force());
        assertNull(tracker.findPending("bob", "course-1").get(0).blockKey());

        assertEquals(1, completionService.triggerReaggregation("course-1", List.of("erin")));
    }

    @Test
    void bulkReadsCoverStoredAndMissingUsers() {
        ContentTree tree = TreeBuilder.sampleCourse("course-1");
        aggregatorRepository.upsertAll("alice", "course-1", tree,
                Map.of("course", new AggregateResult("course", 5.0, 5.0)), clock.instant());
        aggregatorRepository.upsertAll("bob", "course-1", tree,
                Map.of("course", new AggregateResult("course", 0.0, 5.0)), clock.instant());
        tracker.markStale("bob", "course-1", null);

        List<CompletionView> requested = completionService.getCourseCompletions("course-1", List.of("alice", "bob", "zoe"));
        assertEquals(3, requested.size());
        assertEquals(CompletionStatus.CURRENT, requested.get(0).status());
        assertEquals(CompletionStatus.STALE, requested.get(1).status());
        assertEquals(CompletionStatus.NO_DATA, requested.get(2).status());

        assertEquals(2, completionService.getCourseCompletions("course-1", List.of()).size());
        assertEquals(0.5, completionService.meanCourseCompletion("course-1"), EPS);
    }
}
