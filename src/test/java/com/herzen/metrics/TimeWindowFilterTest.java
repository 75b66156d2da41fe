package com.herzen.metrics;

import com.herzen.metrics.aggregation.TimeWindowFilter;
import com.herzen.metrics.domain.MetricModels.TimeFilter;
import com.herzen.metrics.domain.ScoreModels.Submission;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowFilterTest {
    private final TimeWindowFilter filter = new TimeWindowFilter();

    @Test
    void boundsAreInclusive() {
        List<Submission> submissions = List.of(
                submission(1, 999),
                submission(2, 1000),
                submission(3, 1500),
                submission(4, 2000),
                submission(5, 2001));

        List<Submission> kept = filter.filter(submissions, new TimeFilter(1000, 2000));

        assertEquals(List.of(2L, 3L, 4L), kept.stream().map(Submission::sequence).toList());
    }

    @Test
    void unboundedWindowKeepsEverythingInOrder() {
        List<Submission> submissions = List.of(submission(7, 50), submission(3, 0), submission(9, 10));
        assertEquals(submissions, filter.filter(submissions, TimeFilter.UNBOUNDED));
    }

    private static Submission submission(long sequence, long timestamp) {
        return new Submission(sequence, "learner", "item", 50.0, null, timestamp);
    }
}
