/*
 * どこで: OrgMapper ドメインモデル
 * 何を: 最後に同期した Tenant のスナップショットを表す
 * なぜ: desired state との比較だけで up-to-date を判定するため
 */
package com.example.orgmapper.model;

import java.time.Instant;
import java.util.List;

public record TenantObservation(
    String tenantId,
    String orgId,
    List<String> admins,
    List<String> viewerGroups,
    List<String> editorGroups,
    List<String> adminGroups,
    RetentionPolicy retention,
    Instant lastUpdated) {

  public static TenantObservation of(TenantParameters parameters, Instant lastUpdated) {
    return new TenantObservation(
        parameters.tenantId(),
        parameters.orgId(),
        parameters.admins(),
        parameters.viewerGroups(),
        parameters.editorGroups(),
        parameters.adminGroups(),
        parameters.retention(),
        lastUpdated);
  }
}
