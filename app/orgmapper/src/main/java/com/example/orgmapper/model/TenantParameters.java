/*
 * どこで: OrgMapper ドメインモデル
 * 何を: Tenant の desired state を表す
 * なぜ: 1 回の reconcile 中は不変な入力として扱うため
 */
package com.example.orgmapper.model;

import java.util.List;

public record TenantParameters(
    String tenantId,
    String orgId,
    List<String> admins,
    List<String> viewerGroups,
    List<String> editorGroups,
    List<String> adminGroups,
    RetentionPolicy retention) {

  public boolean declaresViewerOrEditorGroups() {
    return !isEmpty(viewerGroups) || !isEmpty(editorGroups);
  }

  private static boolean isEmpty(List<String> values) {
    return values == null || values.isEmpty();
  }
}
