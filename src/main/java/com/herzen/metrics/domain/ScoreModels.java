package com.herzen.metrics.domain;

import java.util.List;

public class ScoreModels {
    /**
     * One raw recorded performance event. {@code sequence} is the feed's insertion order.
     */
    public record Submission(long sequence,
                             String learnerId,
                             String itemId,
                             double score,
                             String tag,
                             long timestamp) {}

    public record SubmissionIn(String learnerId, String itemId, Double score, String tag, Long timestamp) {}

    /**
     * A value fed to a scoring rule: a resolved submission, or a submetric's item score.
     */
    public record ScoreInput(String itemId, double score, long timestamp, String tag) {
        public static ScoreInput of(Submission s) {
            return new ScoreInput(s.itemId(), s.score(), s.timestamp(), s.tag());
        }
    }

    /**
     * Score of one item for one learner; a null score means Absent. {@code latestAt} is the
     * newest submission time behind the score, or null when nothing contributed.
     */
    public record ItemScore(String itemId, String tag, Double score, Long latestAt) {
        public ItemScore(String itemId, String tag, Double score) {
            this(itemId, tag, score, null);
        }

        public boolean isAbsent() {
            return score == null;
        }
    }

    public record MetricScore(String metricId,
                              String learnerId,
                              Double score,
                              long computedAt,
                              List<ItemScore> items) {
        public MetricScore {
            items = items == null ? List.of() : List.copyOf(items);
        }

        public boolean isAbsent() {
            return score == null;
        }

        public ItemScore item(String itemId) {
            return items.stream().filter(i -> i.itemId().equals(itemId)).findFirst().orElse(null);
        }
    }

    public record RecomputeKey(String metricId, String learnerId) {
        @Override
        public String toString() {
            return metricId + "/" + learnerId;
        }
    }

    public record MetricError(String metricId, String learnerId, String kind, String message, long occurredAt) {}

    /**
     * Outcome of an explicit computation over several learners.
     */
    public record ComputeReport(String metricId, List<MetricScore> scores, List<MetricError> failures) {}
}
