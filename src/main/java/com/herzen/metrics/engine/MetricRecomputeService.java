package com.herzen.metrics.engine;

import com.herzen.metrics.coverage.CoverageResolver;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.domain.MetricModels.MetricDefinition;
import com.herzen.metrics.domain.ScoreModels.ComputeReport;
import com.herzen.metrics.domain.ScoreModels.MetricError;
import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.domain.ScoreModels.RecomputeKey;
import com.herzen.metrics.domain.ScoreModels.Submission;
import com.herzen.metrics.error.ErrorKind;
import com.herzen.metrics.error.MetricEngineException;
import com.herzen.metrics.error.MetricNotFoundException;
import com.herzen.metrics.event.ScoreUpdatedEvent;
import com.herzen.metrics.repository.MetricDefinitionJdbcRepository;
import com.herzen.metrics.repository.MetricErrorJdbcRepository;
import com.herzen.metrics.repository.ScoreJdbcRepository;
import com.herzen.metrics.repository.StoreRetry;
import com.herzen.metrics.repository.SubmissionJdbcRepository;
import com.herzen.metrics.service.ContentCatalogService;
import com.herzen.metrics.validation.MetricDefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.Executor;

/**
 * Keeps stored scores current. Qualifying events mark scores stale and, for auto-computed
 * metrics, schedule a background run; explicit requests run immediately on the caller thread.
 * A failed run records a {@link MetricError} and leaves the previously stored score in place.
 */
@Service
public class MetricRecomputeService {
    private static final Logger log = LoggerFactory.getLogger(MetricRecomputeService.class);
    static final String UNEXPECTED = "UNEXPECTED";

    private final MetricDefinitionJdbcRepository definitions;
    private final ScoreJdbcRepository scores;
    private final MetricErrorJdbcRepository errors;
    private final SubmissionJdbcRepository submissions;
    private final ContentCatalogService catalog;
    private final CoverageResolver coverageResolver;
    private final MetricDefinitionValidator validator;
    private final MetricAggregationEngine engine;
    private final StalenessTracker staleness;
    private final StoreRetry storeRetry;
    private final ApplicationEventPublisher publisher;
    private final RecomputeScheduler scheduler;
    private final Duration dependencyTimeout;

    public MetricRecomputeService(MetricDefinitionJdbcRepository definitions,
                                  ScoreJdbcRepository scores,
                                  MetricErrorJdbcRepository errors,
                                  SubmissionJdbcRepository submissions,
                                  ContentCatalogService catalog,
                                  CoverageResolver coverageResolver,
                                  MetricDefinitionValidator validator,
                                  MetricAggregationEngine engine,
                                  StalenessTracker staleness,
                                  StoreRetry storeRetry,
                                  ApplicationEventPublisher publisher,
                                  @Qualifier("metricRecomputeExecutor") Executor executor,
                                  @Qualifier("metricTaskScheduler") TaskScheduler taskScheduler,
                                  @Value("${metrics.recompute.coalesce-delay-ms:200}") long coalesceDelayMs,
                                  @Value("${metrics.recompute.dependency-timeout-ms:5000}") long dependencyTimeoutMs) {
        this.definitions = definitions;
        this.scores = scores;
        this.errors = errors;
        this.submissions = submissions;
        this.catalog = catalog;
        this.coverageResolver = coverageResolver;
        this.validator = validator;
        this.engine = engine;
        this.staleness = staleness;
        this.storeRetry = storeRetry;
        this.publisher = publisher;
        this.dependencyTimeout = Duration.ofMillis(dependencyTimeoutMs);
        this.scheduler = new RecomputeScheduler(executor, taskScheduler, this::runScheduled,
                Duration.ofMillis(coalesceDelayMs));
    }

    /**
     * A new submission affects every metric whose coverage contains the item or one of its ancestors.
     */
    public void onSubmission(Submission submission) {
        Set<String> ancestry = catalog.ancestorsAndSelf(submission.itemId());
        List<MetricDefinition> all = storeRetry.call("definitions.findAll", definitions::findAll);
        Map<String, MetricDefinition> byId = new HashMap<>();
        all.forEach(d -> byId.put(d.id(), d));

        for (MetricDefinition metric : all) {
            if (covers(metric, byId, ancestry)) {
                touch(metric, submission.learnerId());
            }
        }
    }

    /**
     * A stored score change affects every metric using that metric as its submetric, except the
     * metric whose run asked for it.
     */
    public void onScoreUpdated(ScoreUpdatedEvent event) {
        storeRetry.call("definitions.findBySubmetric", () -> definitions.findBySubmetric(event.metricId())).stream()
                .filter(parent -> !parent.id().equals(event.requestedBy()))
                .forEach(parent -> touch(parent, event.learnerId()));
    }

    /**
     * Computes and stores the metric for the given learners now. With no learners given, every
     * learner that has submissions under the metric's coverage is computed.
     *
     * @throws MetricEngineException when the definition is missing or currently invalid
     */
    public ComputeReport computeNow(String metricId, Collection<String> learnerIds) {
        MetricDefinition metric = load(metricId);
        List<MetricDefinition> all = storeRetry.call("definitions.findAll", definitions::findAll);
        validator.requireValid(metric, all);

        Collection<String> learners = learnerIds == null || learnerIds.isEmpty() ? learnersFor(metric, all) : learnerIds;
        List<MetricScore> computed = new ArrayList<>();
        List<MetricError> failures = new ArrayList<>();
        for (String learnerId : new TreeSet<>(learners)) {
            RecomputeKey key = new RecomputeKey(metricId, learnerId);
            try {
                computed.add(scheduler.runExclusive(key, () -> computeRecording(key, null), dependencyTimeout));
            } catch (RuntimeException e) {
                failures.add(errorOf(key, e));
            }
        }
        log.info("Computed metric {} for {} learner(s), {} failure(s)", metricId, computed.size(), failures.size());
        return new ComputeReport(metricId, computed, failures);
    }

    /**
     * Marks every stored score of the metric stale after its definition changed.
     */
    public void invalidate(MetricDefinition metric) {
        storeRetry.call("scores.findByMetric", () -> scores.findByMetric(metric.id()))
                .forEach(score -> touch(metric, score.learnerId()));
    }

    public boolean isStale(String metricId, String learnerId) {
        RecomputeKey key = new RecomputeKey(metricId, learnerId);
        return staleness.isDirty(key) || storeRetry.call("scores.find", () -> scores.find(metricId, learnerId)).isEmpty();
    }

    /**
     * Blocks until no run for the key is in flight. Mostly useful to tests and shutdown hooks.
     */
    public void awaitIdle(String metricId, String learnerId, Duration timeout) {
        scheduler.awaitIdle(new RecomputeKey(metricId, learnerId), timeout);
    }

    public RecomputeScheduler.Phase phase(String metricId, String learnerId) {
        return scheduler.phase(new RecomputeKey(metricId, learnerId));
    }

    public void forgetMetric(String metricId) {
        staleness.forgetMetric(metricId);
    }

    private void touch(MetricDefinition metric, String learnerId) {
        RecomputeKey key = new RecomputeKey(metric.id(), learnerId);
        staleness.markDirty(key);
        if (metric.autoCompute()) {
            scheduler.submit(key);
        } else {
            log.debug("Marked {} stale; metric is not auto-computed", key);
        }
    }

    private boolean covers(MetricDefinition metric, Map<String, MetricDefinition> byId, Set<String> ancestry) {
        Level inputLevel = metric.level();
        if (metric.hasSubmetric()) {
            MetricDefinition submetric = byId.get(metric.submetricId());
            if (submetric == null) return false;
            inputLevel = submetric.level();
        }
        try {
            Set<String> covered = coverageResolver.resolve(inputLevel, metric.coverage());
            return ancestry.stream().anyMatch(covered::contains);
        } catch (MetricEngineException e) {
            log.debug("Skipping metric {} while routing event: {}", metric.id(), e.getMessage());
            return false;
        }
    }

    private void runScheduled(RecomputeKey key) {
        try {
            computeRecording(key, null);
        } catch (MetricNotFoundException e) {
            log.debug("Metric {} was deleted before its scheduled run", key.metricId());
        } catch (RuntimeException e) {
            log.debug("Scheduled recompute of {} failed; error recorded", key);
        }
    }

    private MetricScore computeRecording(RecomputeKey key, String requestedBy) {
        try {
            return computeAndStore(key, requestedBy);
        } catch (MetricNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            staleness.markDirty(key);
            record(errorOf(key, e), e);
            throw e;
        }
    }

    private MetricScore computeAndStore(RecomputeKey key, String requestedBy) {
        staleness.clear(key);
        MetricDefinition metric = load(key.metricId());
        List<MetricDefinition> all = storeRetry.call("definitions.findAll", definitions::findAll);
        validator.requireValid(metric, all);

        MetricDefinition submetric = metric.hasSubmetric()
                ? all.stream().filter(d -> d.id().equals(metric.submetricId())).findFirst()
                        .orElseThrow(() -> new MetricNotFoundException(metric.submetricId()))
                : null;
        MetricScore score = engine.compute(metric, submetric, key.learnerId(),
                () -> currentScore(submetric, key));

        storeRetry.run("scores.replace", () -> scores.replace(score));
        log.info("Recomputed {} = {} over {} item(s)", key, score.score(), score.items().size());
        publisher.publishEvent(new ScoreUpdatedEvent(score.metricId(), score.learnerId(), score.computedAt(), requestedBy));
        return score;
    }

    /**
     * Current stored score of a submetric, recomputing it first when it is stale. Waits for an
     * in-flight run of the submetric at most the dependency timeout.
     */
    private Optional<MetricScore> currentScore(MetricDefinition submetric, RecomputeKey parent) {
        RecomputeKey key = new RecomputeKey(submetric.id(), parent.learnerId());
        scheduler.awaitIdle(key, dependencyTimeout);
        if (isStale(key.metricId(), key.learnerId())) {
            return Optional.of(scheduler.runExclusive(key, () -> computeRecording(key, parent.metricId()), dependencyTimeout));
        }
        return storeRetry.call("scores.find", () -> scores.find(key.metricId(), key.learnerId()));
    }

    private Collection<String> learnersFor(MetricDefinition metric, List<MetricDefinition> all) {
        Level inputLevel = metric.level();
        if (metric.hasSubmetric()) {
            inputLevel = all.stream().filter(d -> d.id().equals(metric.submetricId()))
                    .findFirst().map(MetricDefinition::level).orElse(metric.level());
        }
        Set<String> items = new HashSet<>();
        coverageResolver.resolve(inputLevel, metric.coverage()).forEach(id -> items.addAll(catalog.descendantsAndSelf(id)));
        if (items.isEmpty()) return List.of();
        return storeRetry.call("submissions.learners", () -> submissions.learnersForItems(items));
    }

    private MetricDefinition load(String metricId) {
        return storeRetry.call("definitions.find", () -> definitions.find(metricId))
                .orElseThrow(() -> new MetricNotFoundException(metricId));
    }

    private MetricError errorOf(RecomputeKey key, RuntimeException e) {
        String kind;
        if (e instanceof MetricEngineException me) {
            kind = me.kind().name();
        } else if (e instanceof DataAccessException) {
            kind = ErrorKind.STORE_UNAVAILABLE.name();
        } else {
            kind = UNEXPECTED;
        }
        return new MetricError(key.metricId(), key.learnerId(), kind, e.getMessage(), System.currentTimeMillis());
    }

    private void record(MetricError error, RuntimeException cause) {
        if (UNEXPECTED.equals(error.kind())) {
            log.error("Recompute of {}/{} failed unexpectedly", error.metricId(), error.learnerId(), cause);
        } else {
            log.warn("Recompute of {}/{} failed with {}: {}", error.metricId(), error.learnerId(), error.kind(), error.message());
        }
        try {
            errors.record(error);
        } catch (DataAccessException e) {
            cause.addSuppressed(e);
            log.error("Could not record failure of {}/{}", error.metricId(), error.learnerId(), e);
        }
    }
}
