package com.delta.digest.tracker.api;

import com.delta.digest.tracker.dispatch.DispatchException;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.persistence.JobNotFoundException;
import com.delta.digest.tracker.security.UnauthorizedRequestException;
import com.delta.digest.tracker.service.BatchFailedException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TrackerExceptionHandler {

  @ExceptionHandler(UnauthorizedRequestException.class)
  public ResponseEntity<Map<String, String>> handleUnauthorized(UnauthorizedRequestException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(Map.of("error", "unauthorized", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(BatchFailedException.class)
  public ResponseEntity<PhaseResult> handleBatchFailed(BatchFailedException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(PhaseResult.failed(ex.getJobId(), ex.getBatchIndex(), ex.getMessage()));
  }

  @ExceptionHandler(DispatchException.class)
  public ResponseEntity<Map<String, String>> handleDispatch(DispatchException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "dispatch_failed", "message", ex.getMessage()));
  }
}
