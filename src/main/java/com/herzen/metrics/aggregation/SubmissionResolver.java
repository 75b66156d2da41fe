package com.herzen.metrics.aggregation;

import com.herzen.metrics.domain.MetricModels.MultiplesPolicy;
import com.herzen.metrics.domain.ScoreModels.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses repeated submissions per the multiples policy. Input lists are in feed insertion order.
 */
@Component
public class SubmissionResolver {

    /**
     * Resolves the submissions of one (learner, item). Returns at most one submission, or all of
     * them for {@link MultiplesPolicy#PASS_THROUGH}.
     */
    public List<Submission> resolve(List<Submission> submissions, MultiplesPolicy policy) {
        if (submissions.isEmpty()) return List.of();
        if (policy == MultiplesPolicy.PASS_THROUGH) return List.copyOf(submissions);

        Submission chosen = submissions.get(0);
        for (int i = 1; i < submissions.size(); i++) {
            Submission candidate = submissions.get(i);
            if (prefer(candidate, chosen, policy)) chosen = candidate;
        }
        return List.of(chosen);
    }

    public List<Submission> resolvePerItem(List<Submission> submissions, MultiplesPolicy policy) {
        Map<String, List<Submission>> byItem = new LinkedHashMap<>();
        submissions.forEach(s -> byItem.computeIfAbsent(s.itemId(), k -> new ArrayList<>()).add(s));
        List<Submission> out = new ArrayList<>();
        byItem.values().forEach(group -> out.addAll(resolve(group, policy)));
        return out;
    }

    // candidate comes later in insertion order than current
    private boolean prefer(Submission candidate, Submission current, MultiplesPolicy policy) {
        return switch (policy) {
            case LAST -> candidate.timestamp() >= current.timestamp();
            case FIRST -> candidate.timestamp() < current.timestamp();
            case MAX -> candidate.score() > current.score()
                    || (candidate.score() == current.score() && candidate.timestamp() < current.timestamp());
            case PASS_THROUGH -> false;
        };
    }
}
