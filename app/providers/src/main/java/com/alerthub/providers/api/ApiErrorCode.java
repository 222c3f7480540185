/*
 * どこで: Providers API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.alerthub.providers.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  FORBIDDEN,
  PROVIDER_TYPE_NOT_FOUND,
  PROVIDER_NOT_FOUND,
  METHOD_NOT_FOUND,
  PROVIDER_CONFIGURATION_INVALID,
  SCOPES_PRECONDITION_FAILED,
  PROVIDER_ERROR,
  INVALID_PARAMETERS,
  PROVIDER_ALREADY_INSTALLED,
  INTERNAL_ERROR
}
