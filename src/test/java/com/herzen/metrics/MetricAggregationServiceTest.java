package com.herzen.metrics;

import com.herzen.metrics.domain.ContentModels.ContentItemIn;
import com.herzen.metrics.domain.MetricModels.*;
import com.herzen.metrics.domain.ScoreModels.ComputeReport;
import com.herzen.metrics.domain.ScoreModels.ItemScore;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.domain.ScoreModels.SubmissionIn;
import com.herzen.metrics.engine.MetricRecomputeService;
import com.herzen.metrics.error.UnknownItemException;
import com.herzen.metrics.service.ContentCatalogService;
import com.herzen.metrics.service.MetricDefinitionService;
import com.herzen.metrics.service.ScoreQueryService;
import com.herzen.metrics.service.SubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MetricAggregationServiceTest {
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

    private String p;
    private String learner;

    @BeforeEach
    void setUp() {
        p = UUID.randomUUID().toString().substring(0, 8) + "-";
        learner = p + "learner";
        catalogService.register(List.of(
                new ContentItemIn(p + "prog", "program", null, null),
                new ContentItemIn(p + "ns", "namespace", p + "prog", null),
                new ContentItemIn(p + "l1", "lesson", p + "ns", "A"),
                new ContentItemIn(p + "l2", "lesson", p + "ns", "B"),
                new ContentItemIn(p + "c1", "component", p + "l1", null),
                new ContentItemIn(p + "c2", "component", p + "l2", null),
                new ContentItemIn(p + "c3", "component", p + "l1", null)));
    }

    @Test
    void weightedLessonScore() {
        submit("c1", 80, 1_000);
        submit("c2", 60, 1_000);
        MetricDefinition metric = definitionService.create(lessonMetric("weighted", Map.of("A", 3.0, "B", 1.0), false));

        MetricScore score = computeOne(metric);

        assertEquals(75.0, score.score(), 1e-9);
        assertEquals(80.0, score.item(p + "l1").score(), 1e-9);
        assertEquals("A", score.item(p + "l1").tag());
        assertEquals(60.0, score.item(p + "l2").score(), 1e-9);
        assertNotNull(definitionService.get(metric.id()).lastUpdated());
    }

    @Test
    void recomputeWithoutNewInputIsIdempotent() {
        submit("c1", 80, 1_000);
        submit("c3", 40, 2_000);
        MetricDefinition metric = definitionService.create(lessonMetric("idempotent", null, false));

        MetricScore first = computeOne(metric);
        MetricScore second = computeOne(metric);

        assertEquals(first.score(), second.score());
        assertEquals(first.items(), second.items());
        assertEquals(60.0, first.item(p + "l1").score(), 1e-9);
        assertTrue(first.item(p + "l2").isAbsent());
    }

    @Test
    void learnerWithoutSubmissionsIsAbsent() {
        MetricDefinition metric = definitionService.create(lessonMetric("absent", null, false));

        ComputeReport report = recomputeService.computeNow(metric.id(), List.of(p + "nobody"));

        MetricScore score = report.scores().get(0);
        assertTrue(score.isAbsent());
        assertTrue(score.items().stream().allMatch(ItemScore::isAbsent));
    }

    @Test
    void multiplesPolicyAndTimeFilterApply() {
        submit("c1", 70, 1_000);
        submit("c1", 90, 3_000);
        submit("c1", 100, 9_000);
        MetricDefinition metric = definitionService.create(new MetricDefinition(null, p + "windowed", Level.LESSON,
                Coverage.fromArray(List.of("include", p + "l1")), Rule.of("average"), null, null,
                new TimeFilter(0, 5_000), MultiplesPolicy.LAST, false, false, null));

        assertEquals(90.0, computeOne(metric).score(), 1e-9);
    }

    @Test
    void submetricChainRecomputesStaleSubmetricFirst() {
        submit("c1", 80, 1_000);
        submit("c2", 60, 1_000);
        MetricDefinition lesson = definitionService.create(lessonMetric("sub", null, false));
        MetricDefinition namespace = definitionService.create(new MetricDefinition(null, p + "chain", Level.NAMESPACE,
                Coverage.fromArray(List.of("include", p + "l1", p + "l2")), Rule.of("average"), lesson.id(),
                null, null, null, false, false, null));

        MetricScore score = computeOne(namespace);

        assertEquals(70.0, score.score(), 1e-9);
        assertEquals(1, score.items().size());
        assertEquals(p + "ns", score.items().get(0).itemId());
        assertEquals(70.0, score.items().get(0).score(), 1e-9);
        assertFalse(recomputeService.isStale(lesson.id(), learner));
    }

    @Test
    void decayedAverageOverSubmetricUsesSubmissionTime() {
        submit("c1", 80, 1_000);
        MetricDefinition lesson = definitionService.create(lessonMetric("on-time-sub", null, false));
        MetricDefinition namespace = definitionService.create(new MetricDefinition(null, p + "on-time", Level.NAMESPACE,
                Coverage.fromArray(List.of("include", p + "l1")), Rule.of("decayedAverage", 2_000, 60), lesson.id(),
                null, null, null, false, false, null));

        MetricScore first = computeOne(namespace);
        recomputeService.computeNow(lesson.id(), List.of(learner));
        MetricScore second = computeOne(namespace);

        assertEquals(80.0, first.score(), 1e-9);
        assertEquals(1_000L, first.items().get(0).latestAt());
        assertEquals(first.score(), second.score());
        assertEquals(1_000L, scoreQueryService.scoresOf(lesson.id()).get(0).item(p + "l1").latestAt());
    }

    @Test
    void definitionWithDelimiterCharactersSurvivesStorage() {
        String oddItem = p + "x-unit 1, part 2";
        catalogService.register(List.of(new ContentItemIn(oddItem, "lesson", p + "ns", "level=hard;x")));
        submissionService.record(new SubmissionIn(learner, oddItem, 80.0, null, 1_000L));
        Map<String, Double> weights = Map.of("level=hard;x", 2.0, "a,b", 1.0);
        MetricDefinition created = definitionService.create(new MetricDefinition(null, p + "delimiters", Level.LESSON,
                Coverage.fromArray(List.of("include", oddItem, p + "l1")), Rule.of("decayedAverage", 2_000, 60, 30),
                null, weights, null, null, false, false, null));

        MetricDefinition stored = definitionService.get(created.id());

        assertEquals(created.coverage(), stored.coverage());
        assertEquals(created.rule(), stored.rule());
        assertEquals(weights, stored.tagWeights());
        assertTrue(definitionService.list().stream().anyMatch(d -> d.id().equals(created.id())));
        MetricScore score = computeOne(stored);
        assertEquals(80.0, score.score(), 1e-9);
        assertEquals("level=hard;x", score.item(oddItem).tag());
    }

    @Test
    void explicitComputeDefaultsToLearnersWithSubmissions() {
        submit("c1", 50, 1_000);
        submissionService.record(new SubmissionIn(p + "other", p + "c2", 30.0, null, 1_000L));
        MetricDefinition metric = definitionService.create(lessonMetric("everyone", null, false));

        ComputeReport report = recomputeService.computeNow(metric.id(), List.of());

        assertEquals(List.of(p + "learner", p + "other"),
                report.scores().stream().map(MetricScore::learnerId).sorted().toList());
        assertTrue(report.failures().isEmpty());
        assertEquals(2, scoreQueryService.scoresOf(metric.id()).size());
    }

    @Test
    void learnerViewHonoursVisibility() {
        submit("c1", 50, 1_000);
        MetricDefinition hidden = definitionService.create(lessonMetric("hidden", null, false));
        MetricDefinition shown = definitionService.create(new MetricDefinition(null, p + "shown", Level.LESSON,
                Coverage.fromArray(List.of("include", p + "l1")), Rule.of("average"), null, null,
                null, null, false, true, null));
        computeOne(hidden);
        computeOne(shown);

        List<String> visible = scoreQueryService.scoresOfLearner(learner, true).stream().map(MetricScore::metricId).toList();
        List<String> all = scoreQueryService.scoresOfLearner(learner, false).stream().map(MetricScore::metricId).toList();

        assertEquals(List.of(shown.id()), visible);
        assertTrue(all.containsAll(List.of(hidden.id(), shown.id())));
    }

    @Test
    void clearingScoresMakesThemStale() {
        submit("c1", 50, 1_000);
        MetricDefinition metric = definitionService.create(lessonMetric("cleared", null, false));
        computeOne(metric);
        assertFalse(recomputeService.isStale(metric.id(), learner));

        assertEquals(1, scoreQueryService.clearScores(metric.id()));
        assertTrue(recomputeService.isStale(metric.id(), learner));
    }

    @Test
    void submissionsForUnknownItemsOrOutOfRangeScoresAreRejected() {
        assertThrows(UnknownItemException.class,
                () -> submissionService.record(new SubmissionIn(learner, p + "nope", 50.0, null, 1L)));
        assertThrows(IllegalArgumentException.class,
                () -> submissionService.record(new SubmissionIn(learner, p + "c1", 101.0, null, 1L)));
    }

    private MetricScore computeOne(MetricDefinition metric) {
        ComputeReport report = recomputeService.computeNow(metric.id(), List.of(learner));
        assertTrue(report.failures().isEmpty(), () -> "failures: " + report.failures());
        return report.scores().get(0);
    }

    private void submit(String item, double score, long timestamp) {
        submissionService.record(new SubmissionIn(learner, p + item, score, null, timestamp));
    }

    private MetricDefinition lessonMetric(String name, Map<String, Double> weights, boolean autoCompute) {
        return new MetricDefinition(null, p + name, Level.LESSON,
                Coverage.fromArray(List.of("include", p + "l1", p + "l2")), Rule.of("average"), null,
                weights, null, MultiplesPolicy.LAST, autoCompute, false, null);
    }
}
