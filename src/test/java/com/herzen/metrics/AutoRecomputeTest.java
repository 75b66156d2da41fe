package com.herzen.metrics;

import com.herzen.metrics.domain.ContentModels.ContentItemIn;
import com.herzen.metrics.domain.MetricModels.*;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.domain.ScoreModels.SubmissionIn;
import com.herzen.metrics.domain.ScoreModels.ComputeReport;
import com.herzen.metrics.engine.MetricAggregationEngine;
import com.herzen.metrics.engine.MetricRecomputeService;
import com.herzen.metrics.engine.RecomputeScheduler.Phase;
import com.herzen.metrics.error.UnknownRuleException;
import com.herzen.metrics.repository.MetricDefinitionJdbcRepository;
import com.herzen.metrics.repository.ScoreJdbcRepository;
import com.herzen.metrics.service.ContentCatalogService;
import com.herzen.metrics.service.MetricDefinitionService;
import com.herzen.metrics.service.ScoreQueryService;
import com.herzen.metrics.service.SubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;

@SpringBootTest
class AutoRecomputeTest {
    @Autowired
    private ContentCatalogService catalogService;
    @Autowired
    private SubmissionService submissionService;
    @Autowired
    private MetricDefinitionService definitionService;
    @Autowired
    private MetricRecomputeService recomputeService;
    @Autowired
    private ScoreQueryService scoreQueryService;
    @Autowired
    private ScoreJdbcRepository scoreRepository;
    @Autowired
    private MetricDefinitionJdbcRepository definitionRepository;
    @SpyBean
    private MetricAggregationEngine engine;

    private String p;
    private String learner;

    @BeforeEach
    void setUp() {
        p = UUID.randomUUID().toString().substring(0, 8) + "-";
        learner = p + "learner";
        catalogService.register(List.of(
                new ContentItemIn(p + "ns", "namespace", null, null),
                new ContentItemIn(p + "l1", "lesson", p + "ns", null),
                new ContentItemIn(p + "l2", "lesson", p + "ns", null),
                new ContentItemIn(p + "c1", "component", p + "l1", null),
                new ContentItemIn(p + "c2", "component", p + "l2", null)));
    }

    @Test
    void submissionTriggersAutoComputedMetric() throws Exception {
        MetricDefinition metric = definitionService.create(lessonMetric("auto", true));

        submit("c1", 40);
        submit("c1", 80);

        waitUntil(() -> score(metric).filter(s -> s.score() != null && s.score() == 80.0).isPresent());
        recomputeService.awaitIdle(metric.id(), learner, Duration.ofSeconds(2));
        assertEquals(80.0, score(metric).orElseThrow().score(), 1e-9);
    }

    @Test
    void manualMetricIsOnlyMarkedStale() throws Exception {
        MetricDefinition metric = definitionService.create(lessonMetric("manual", false));

        submit("c1", 40);
        Thread.sleep(200);

        assertTrue(score(metric).isEmpty());
        assertTrue(recomputeService.isStale(metric.id(), learner));
    }

    @Test
    void submetricUpdatePropagatesToAutoComputedParent() throws Exception {
        MetricDefinition lesson = definitionService.create(lessonMetric("child", false));
        MetricDefinition namespace = definitionService.create(new MetricDefinition(null, p + "parent", Level.NAMESPACE,
                Coverage.fromArray(List.of("include", p + "l1", p + "l2")), Rule.of("average"), lesson.id(),
                null, null, null, true, false, null));

        submit("c1", 90);
        submit("c2", 50);

        waitUntil(() -> score(namespace).filter(s -> s.score() != null && s.score() == 70.0).isPresent());
        assertEquals(70.0, score(namespace).orElseThrow().score(), 1e-9);
        assertTrue(score(lesson).isPresent());
    }

    @Test
    void failedRunRecordsErrorAndKeepsPreviousScore() throws Exception {
        MetricDefinition metric = definitionService.create(lessonMetric("fragile", true));
        submit("c1", 60);
        waitUntil(() -> score(metric).isPresent());
        recomputeService.awaitIdle(metric.id(), learner, Duration.ofSeconds(2));
        MetricScore before = score(metric).orElseThrow();

        // bypasses validation to simulate a definition broken underneath the engine
        definitionRepository.update(new MetricDefinition(metric.id(), metric.name(), metric.level(), metric.coverage(),
                Rule.of("median"), null, null, null, null, true, false, null));
        submit("c1", 100);

        waitUntil(() -> !scoreQueryService.errorsOf(metric.id()).isEmpty());
        assertEquals("UNKNOWN_RULE", scoreQueryService.errorsOf(metric.id()).get(0).kind());
        assertEquals(before, score(metric).orElseThrow());
        assertThrows(UnknownRuleException.class, () -> recomputeService.computeNow(metric.id(), List.of(learner)));
    }

    @Test
    void submissionOutsideCoverageLeavesMetricUntouched() throws Exception {
        MetricDefinition included = definitionService.create(new MetricDefinition(null, p + "only-l1", Level.LESSON,
                Coverage.fromArray(List.of("include", p + "l1")), Rule.of("average"), null,
                null, null, null, true, false, null));
        MetricDefinition excluded = definitionService.create(new MetricDefinition(null, p + "not-l1", Level.LESSON,
                Coverage.fromArray(List.of("exclude", p + "l1")), Rule.of("average"), null,
                null, null, null, true, false, null));

        submit("c1", 60);
        waitUntil(() -> score(included).isPresent());
        recomputeService.awaitIdle(included.id(), learner, Duration.ofSeconds(2));
        MetricScore before = score(included).orElseThrow();
        assertTrue(score(excluded).isEmpty());
        assertEquals(Phase.IDLE, recomputeService.phase(excluded.id(), learner));

        submit("c2", 50);
        assertEquals(Phase.IDLE, recomputeService.phase(included.id(), learner));
        assertFalse(recomputeService.isStale(included.id(), learner));

        waitUntil(() -> score(excluded).filter(s -> s.score() != null && s.score() == 50.0).isPresent());
        assertEquals(before, score(included).orElseThrow());
        assertFalse(recomputeService.isStale(included.id(), learner));
    }

    @Test
    void unexpectedFailureIsRecordedAndLeavesScoreStale() throws Exception {
        AtomicBoolean explode = new AtomicBoolean();
        doAnswer(invocation -> {
            if (explode.get()) throw new IllegalStateException("engine exploded");
            return invocation.callRealMethod();
        }).when(engine).compute(argThat(m -> m != null && m.name().endsWith("exploding")), any(), any(), any());
        MetricDefinition metric = definitionService.create(lessonMetric("exploding", true));
        submit("c1", 70);
        waitUntil(() -> score(metric).isPresent());
        recomputeService.awaitIdle(metric.id(), learner, Duration.ofSeconds(2));
        MetricScore before = score(metric).orElseThrow();
        assertFalse(recomputeService.isStale(metric.id(), learner));

        explode.set(true);
        submit("c1", 90);

        waitUntil(() -> !scoreQueryService.errorsOf(metric.id()).isEmpty());
        recomputeService.awaitIdle(metric.id(), learner, Duration.ofSeconds(2));
        assertEquals("UNEXPECTED", scoreQueryService.errorsOf(metric.id()).get(0).kind());
        assertEquals(before, score(metric).orElseThrow());
        assertTrue(recomputeService.isStale(metric.id(), learner));

        ComputeReport report = recomputeService.computeNow(metric.id(), List.of(learner));
        assertTrue(report.scores().isEmpty());
        assertEquals("engine exploded", report.failures().get(0).message());
    }

    private Optional<MetricScore> score(MetricDefinition metric) {
        return scoreRepository.find(metric.id(), learner);
    }

    private void submit(String item, double score) {
        submissionService.record(new SubmissionIn(learner, p + item, score, null, System.currentTimeMillis()));
    }

    private MetricDefinition lessonMetric(String name, boolean autoCompute) {
        return new MetricDefinition(null, p + name, Level.LESSON,
                Coverage.fromArray(List.of("include", p + "l1", p + "l2")), Rule.of("average"), null,
                null, null, MultiplesPolicy.LAST, autoCompute, false, null);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("Condition not met within 5s");
            Thread.sleep(20);
        }
    }
}
