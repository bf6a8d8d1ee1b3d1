/*
 * どこで: OrgMapper API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: reconcile 由来の失敗も含めてエラー応答を統一するため
 */
package com.example.orgmapper.api;

import com.example.orgmapper.grafana.GrafanaIntegrationException;
import com.example.orgmapper.repository.TenantStoreException;
import com.example.orgmapper.service.TenantConflictException;
import com.example.orgmapper.service.TenantNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(TenantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(TenantNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.TENANT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(TenantConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(TenantConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.TENANT_ID_CONFLICT, ex.getMessage()));
  }

  @ExceptionHandler(GrafanaIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleGrafana(GrafanaIntegrationException ex) {
    logger.warn("grafana integration failed reason={}", ex.reason(), ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.GRAFANA_UNAVAILABLE, "grafana " + ex.reason().name().toLowerCase()));
  }

  @ExceptionHandler(TenantStoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStore(TenantStoreException ex) {
    logger.warn("tenant store failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, "tenant store unavailable"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
