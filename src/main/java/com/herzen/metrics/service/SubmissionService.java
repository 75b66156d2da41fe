package com.herzen.metrics.service;

import com.herzen.metrics.domain.ScoreModels.Submission;
import com.herzen.metrics.domain.ScoreModels.SubmissionIn;
import com.herzen.metrics.error.UnknownItemException;
import com.herzen.metrics.event.SubmissionRecordedEvent;
import com.herzen.metrics.repository.StoreRetry;
import com.herzen.metrics.repository.SubmissionJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Append-only submission feed. Each recorded submission is announced as a {@link SubmissionRecordedEvent}.
 */
@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final SubmissionJdbcRepository repository;
    private final ContentCatalogService catalog;
    private final StoreRetry storeRetry;
    private final ApplicationEventPublisher publisher;

    public SubmissionService(SubmissionJdbcRepository repository,
                             ContentCatalogService catalog,
                             StoreRetry storeRetry,
                             ApplicationEventPublisher publisher) {
        this.repository = repository;
        this.catalog = catalog;
        this.storeRetry = storeRetry;
        this.publisher = publisher;
    }

    public Submission record(SubmissionIn in) {
        if (in == null || in.learnerId() == null || in.learnerId().isBlank()) {
            throw new IllegalArgumentException("learnerId is required");
        }
        if (in.itemId() == null || catalog.find(in.itemId()).isEmpty()) {
            throw new UnknownItemException("Submission references an unknown item: " + in.itemId(),
                    in.itemId() == null ? Set.of() : Set.of(in.itemId()));
        }
        if (in.score() == null || in.score() < 0 || in.score() > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100");
        }
        String tag = in.tag() == null || in.tag().isBlank() ? null : in.tag().trim();
        long timestamp = in.timestamp() == null ? System.currentTimeMillis() : in.timestamp();

        Submission saved = storeRetry.call("submissions.append",
                () -> repository.append(in.learnerId().trim(), in.itemId(), in.score(), tag, timestamp));
        log.debug("Recorded submission #{} of {} on {}", saved.sequence(), saved.learnerId(), saved.itemId());
        publisher.publishEvent(new SubmissionRecordedEvent(saved));
        return saved;
    }
}
