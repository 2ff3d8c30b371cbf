/*
 * Where: Notification admin API
 * What: Maps exceptions from admin endpoints to the common error body
 * Why: Keeps the failure contract fixed for the admin UI that calls these hooks
 */
package com.safetyops.notification.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class NotificationApiExceptionHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationApiExceptionHandler.class);

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(DataAccessException ex) {
    logger.error("admin request failed on persisted store", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("STORE_UNAVAILABLE", "persisted store unavailable"));
  }
}
