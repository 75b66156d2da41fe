package com.herzen.metrics.aggregation;

import com.herzen.metrics.domain.MetricModels.TimeFilter;
import com.herzen.metrics.domain.ScoreModels.Submission;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TimeWindowFilter {

    public List<Submission> filter(List<Submission> submissions, TimeFilter window) {
        return submissions.stream().filter(s -> window.contains(s.timestamp())).toList();
    }
}
