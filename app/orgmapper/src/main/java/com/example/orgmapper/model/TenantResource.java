/*
 * どこで: OrgMapper ドメインモデル
 * 何を: tenants テーブルの 1 レコード(desired + observed + 削除マーカー)を表す
 * なぜ: reconcile 1 サイクル分の入力をまとめて受け渡すため
 */
package com.example.orgmapper.model;

import java.time.Instant;
import java.util.UUID;

public record TenantResource(
    String name,
    UUID uid,
    TenantParameters parameters,
    TenantObservation observation,
    Instant deletionRequestedAt,
    Instant createdAt)
    implements ManagedResource {

  public static final String KIND = "Tenant";

  @Override
  public String kind() {
    return KIND;
  }

  public boolean deletionRequested() {
    return deletionRequestedAt != null;
  }

  public TenantResource withObservation(TenantObservation newObservation) {
    return new TenantResource(
        name, uid, parameters, newObservation, deletionRequestedAt, createdAt);
  }
}
