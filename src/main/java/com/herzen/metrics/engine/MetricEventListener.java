package com.herzen.metrics.engine;

import com.herzen.metrics.event.ScoreUpdatedEvent;
import com.herzen.metrics.event.SubmissionRecordedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class MetricEventListener {
    private final MetricRecomputeService recomputeService;

    public MetricEventListener(MetricRecomputeService recomputeService) {
        this.recomputeService = recomputeService;
    }

    @EventListener
    public void onSubmissionRecorded(SubmissionRecordedEvent event) {
        recomputeService.onSubmission(event.submission());
    }

    @EventListener
    public void onScoreUpdated(ScoreUpdatedEvent event) {
        recomputeService.onScoreUpdated(event);
    }
}
