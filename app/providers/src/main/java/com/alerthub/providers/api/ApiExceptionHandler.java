/*
 * どこで: Providers API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: プロバイダ連携の失敗分類ごとに一貫したステータスとコードを返すため
 */
package com.alerthub.providers.api;

import com.alerthub.providers.service.ProviderAlreadyInstalledException;
import com.alerthub.providers.service.ProviderInternalException;
import com.alerthub.providers.service.ProviderNotFoundException;
import com.alerthub.providers.service.ScopeValidationFailedException;
import com.alerthub.providers.spi.InvalidParametersException;
import com.alerthub.providers.spi.ProviderConfigurationException;
import com.alerthub.providers.spi.ProviderException;
import com.alerthub.providers.spi.ProviderMethodException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String INTERNAL_MESSAGE = "internal server error";

  @ExceptionHandler(ProviderNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ProviderNotFoundException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case PROVIDER_TYPE -> ApiErrorCode.PROVIDER_TYPE_NOT_FOUND;
          case PROVIDER -> ApiErrorCode.PROVIDER_NOT_FOUND;
          case METHOD -> ApiErrorCode.METHOD_NOT_FOUND;
        };
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(ScopeValidationFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleScopesPrecondition(
      ScopeValidationFailedException ex) {
    return ResponseEntity.status(HttpStatus.PRECONDITION_FAILED)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.SCOPES_PRECONDITION_FAILED,
                ex.getMessage(),
                ex.validatedScopes(),
                null));
  }

  @ExceptionHandler(ProviderConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(ProviderConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.PROVIDER_CONFIGURATION_INVALID,
                ex.getMessage(),
                null,
                ex.invalidFields().isEmpty() ? null : ex.invalidFields()));
  }

  @ExceptionHandler(ProviderMethodException.class)
  public ResponseEntity<ApiErrorResponse> handleProviderMethod(ProviderMethodException ex) {
    // プロバイダが決めたステータスをそのまま返す。範囲外は 400 に寄せる。
    final int status = ex.statusCode();
    final HttpStatusCode statusCode =
        status >= 400 && status <= 599
            ? HttpStatusCode.valueOf(status)
            : HttpStatusCode.valueOf(HttpStatus.BAD_REQUEST.value());
    return ResponseEntity.status(statusCode)
        .body(new ApiErrorResponse(ApiErrorCode.PROVIDER_ERROR, ex.getMessage()));
  }

  @ExceptionHandler(InvalidParametersException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidParameters(InvalidParametersException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_PARAMETERS, ex.getMessage()));
  }

  @ExceptionHandler(ProviderAlreadyInstalledException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyInstalled(
      ProviderAlreadyInstalledException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.PROVIDER_ALREADY_INSTALLED, ex.getMessage()));
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleProvider(ProviderException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(AccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ApiErrorCode.FORBIDDEN, "permission denied"));
  }

  @ExceptionHandler(ProviderInternalException.class)
  public ResponseEntity<ApiErrorResponse> handleInternal(ProviderInternalException ex) {
    // 原因は呼び出し元のサービスで文脈付きで記録済み。
    return internalError();
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse
        && errorResponse.getStatusCode().is4xxClientError()) {
      // 未定義パスやメソッド不一致など MVC 側で判定済みのクライアントエラー。
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(
              new ApiErrorResponse(
                  ApiErrorCode.BAD_REQUEST, errorResponse.getBody().getDetail()));
    }
    logger.error("unhandled exception in providers api", ex);
    return internalError();
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private ResponseEntity<ApiErrorResponse> internalError() {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, INTERNAL_MESSAGE));
  }
}
