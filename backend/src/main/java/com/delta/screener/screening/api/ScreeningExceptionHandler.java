package com.delta.screener.screening.api;

import com.delta.screener.screening.service.InvalidResumeTextException;
import com.delta.screener.screening.service.InvalidScreeningRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScreeningExceptionHandler {

  @ExceptionHandler(InvalidResumeTextException.class)
  public ResponseEntity<Map<String, String>> handleInvalidText(InvalidResumeTextException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_resume_text", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidScreeningRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidScreeningRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_screening_request", "message", ex.getMessage()));
  }
}
