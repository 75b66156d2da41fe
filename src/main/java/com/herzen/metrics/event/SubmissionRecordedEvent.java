package com.herzen.metrics.event;

import com.herzen.metrics.domain.ScoreModels.Submission;

public record SubmissionRecordedEvent(Submission submission) {}
