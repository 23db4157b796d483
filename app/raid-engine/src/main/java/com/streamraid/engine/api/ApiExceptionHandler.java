/*
 * どこで: Raid Engine API
 * 何を: 参加/請求の失敗を HTTP ステータスとエラーコードへ変換する
 * なぜ: 呼び出し側が失敗理由を機械的に判別できるようにするため
 */
package com.streamraid.engine.api;

import com.streamraid.engine.auth.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRaidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidRaidRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, "RAID_BAD_REQUEST", ex.getMessage());
  }

  @ExceptionHandler({
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "RAID_BAD_REQUEST", "request is malformed");
  }

  @ExceptionHandler(RaidNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRaidNotFound(RaidNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "RAID_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(ParticipantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleParticipantNotFound(
      ParticipantNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "PARTICIPANT_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(RaidNotActiveException.class)
  public ResponseEntity<ApiErrorResponse> handleNotActive(RaidNotActiveException ex) {
    return error(HttpStatus.CONFLICT, "RAID_NOT_ACTIVE", ex.getMessage());
  }

  @ExceptionHandler(RaidFullException.class)
  public ResponseEntity<ApiErrorResponse> handleFull(RaidFullException ex) {
    return error(HttpStatus.CONFLICT, "RAID_FULL", ex.getMessage());
  }

  @ExceptionHandler(PremiumRequiredException.class)
  public ResponseEntity<ApiErrorResponse> handlePremiumRequired(PremiumRequiredException ex) {
    return error(HttpStatus.FORBIDDEN, "RAID_PREMIUM_REQUIRED", ex.getMessage());
  }

  @ExceptionHandler(AlreadyQualifiedException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyQualified(AlreadyQualifiedException ex) {
    return error(HttpStatus.CONFLICT, "PARTICIPANT_ALREADY_QUALIFIED", ex.getMessage());
  }

  @ExceptionHandler(NotQualifiedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotQualified(NotQualifiedException ex) {
    return error(HttpStatus.CONFLICT, "CLAIM_NOT_QUALIFIED", ex.getMessage());
  }

  @ExceptionHandler(AlreadyClaimedException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyClaimed(AlreadyClaimedException ex) {
    return error(HttpStatus.CONFLICT, "CLAIM_ALREADY_CLAIMED", ex.getMessage());
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnauthenticated(UnauthenticatedException ex) {
    return error(HttpStatus.UNAUTHORIZED, "PLATFORM_UNAUTHENTICATED", ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled raid api error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "RAID_INTERNAL_ERROR", "internal error");
  }

  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
