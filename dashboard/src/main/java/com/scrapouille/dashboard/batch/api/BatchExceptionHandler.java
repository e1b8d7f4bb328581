package com.scrapouille.dashboard.batch.api;

import com.scrapouille.dashboard.batch.service.ActiveBatchRunException;
import com.scrapouille.dashboard.batch.service.BatchValidationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BatchExceptionHandler {

  @ExceptionHandler(ActiveBatchRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveBatchRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_batch_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(BatchValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(BatchValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_batch_request", "message", ex.getMessage()));
  }
}
