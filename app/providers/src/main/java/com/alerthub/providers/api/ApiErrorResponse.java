/*
 * どこで: Providers API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因を識別しやすくするため
 */
package com.alerthub.providers.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    ApiErrorCode code,
    String message,
    Map<String, Object> validatedScopes,
    List<String> invalidFields) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null, null);
  }
}
