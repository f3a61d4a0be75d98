/*
 * どこで: Subscription API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.example.subscription.api;

import com.example.subscription.service.RedemptionCancelledException;
import com.example.subscription.service.SubscriptionNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SubscriptionNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(SubscriptionNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.SUBSCRIPTION_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    return badRequest("request body is invalid");
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ApiErrorResponse> handleStorageFailure(RuntimeException ex) {
    // バッチはロールバック済み。次回の実行で同じ対象が再スキャンされる。
    logger.error("redemption request failed in storage layer", ex);
    return internalError("storage failure");
  }

  @ExceptionHandler(RedemptionCancelledException.class)
  public ResponseEntity<ApiErrorResponse> handleCancelled(RedemptionCancelledException ex) {
    logger.warn("redemption request cancelled message={}", ex.getMessage());
    return internalError(Optional.ofNullable(ex.getMessage()).orElse("redemption cancelled"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private ResponseEntity<ApiErrorResponse> internalError(String message) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
