/*
 * どこで: OrgMapper API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.orgmapper.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  TENANT_NOT_FOUND,
  TENANT_ID_CONFLICT,
  GRAFANA_UNAVAILABLE,
  STORE_UNAVAILABLE
}
