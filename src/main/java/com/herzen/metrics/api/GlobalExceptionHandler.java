package com.herzen.metrics.api;

import com.herzen.metrics.error.CyclicMetricReferenceException;
import com.herzen.metrics.error.InvalidMetricDefinitionException;
import com.herzen.metrics.error.MetricEngineException;
import com.herzen.metrics.error.MetricInUseException;
import com.herzen.metrics.error.UnknownItemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MetricInUseException.class)
    public ResponseEntity<ProblemDetail> handleInUse(MetricInUseException ex) {
        return problem(HttpStatus.CONFLICT, "Metric In Use", ex);
    }

    @ExceptionHandler(MetricEngineException.class)
    public ResponseEntity<ProblemDetail> handleEngine(MetricEngineException ex) {
        HttpStatus status = switch (ex.kind()) {
            case UNKNOWN_METRIC -> HttpStatus.NOT_FOUND;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DEPENDENCY_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UNKNOWN_ITEM, UNKNOWN_RULE, CYCLIC_METRIC_REFERENCE, INVALID_DEFINITION -> HttpStatus.BAD_REQUEST;
        };
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.kind(), ex.getMessage());
        }
        ResponseEntity<ProblemDetail> response = problem(status, title(ex), ex);
        ProblemDetail body = response.getBody();
        if (body != null) {
            if (ex instanceof CyclicMetricReferenceException cyclic) body.setProperty("path", cyclic.path());
            if (ex instanceof UnknownItemException unknown) body.setProperty("itemIds", unknown.itemIds());
            if (ex instanceof InvalidMetricDefinitionException invalid && !invalid.issues().isEmpty()) {
                body.setProperty("issues", invalid.issues());
            }
        }
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, MetricEngineException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(title);
        problem.setProperty("kind", ex.kind().name());
        return ResponseEntity.status(status).body(problem);
    }

    private String title(MetricEngineException ex) {
        return switch (ex.kind()) {
            case UNKNOWN_METRIC -> "Metric Not Found";
            case UNKNOWN_ITEM -> "Unknown Item";
            case UNKNOWN_RULE -> "Unknown Rule";
            case CYCLIC_METRIC_REFERENCE -> "Cyclic Metric Reference";
            case INVALID_DEFINITION -> "Invalid Metric Definition";
            case DEPENDENCY_TIMEOUT -> "Dependency Timeout";
            case STORE_UNAVAILABLE -> "Store Unavailable";
        };
    }
}
