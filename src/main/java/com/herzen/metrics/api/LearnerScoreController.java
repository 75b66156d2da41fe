package com.herzen.metrics.api;

import com.herzen.metrics.domain.ScoreModels.MetricScore;
import com.herzen.metrics.service.ScoreQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/learners")
public class LearnerScoreController {
    private final ScoreQueryService scoreQueryService;

    public LearnerScoreController(ScoreQueryService scoreQueryService) {
        this.scoreQueryService = scoreQueryService;
    }

    @GetMapping("/{learnerId}/scores")
    public ResponseEntity<List<MetricScore>> scores(@PathVariable String learnerId,
                                                    @RequestParam(defaultValue = "false") boolean visibleOnly) {
        return ResponseEntity.ok(scoreQueryService.scoresOfLearner(learnerId, visibleOnly));
    }
}
