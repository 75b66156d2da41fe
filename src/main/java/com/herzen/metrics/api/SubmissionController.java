package com.herzen.metrics.api;

import com.herzen.metrics.domain.ScoreModels.Submission;
import com.herzen.metrics.domain.ScoreModels.SubmissionIn;
import com.herzen.metrics.service.SubmissionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/submissions")
public class SubmissionController {
    private final SubmissionService submissionService;

    public SubmissionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping
    public ResponseEntity<Submission> record(@RequestBody SubmissionIn request) {
        return ResponseEntity.ok(submissionService.record(request));
    }
}
