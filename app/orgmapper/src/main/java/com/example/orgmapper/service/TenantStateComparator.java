package com.example.orgmapper.service;

import com.example.orgmapper.model.RetentionPolicy;
import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.Objects;

/** Field-by-field comparison of desired and last synchronised tenant state. */
public final class TenantStateComparator {

  private TenantStateComparator() {}

  public static boolean isUpToDate(TenantParameters desired, TenantObservation observed) {
    if (desired == null || observed == null) {
      return false;
    }
    return Objects.equals(desired.tenantId(), observed.tenantId())
        && Objects.equals(desired.orgId(), observed.orgId())
        && retentionOf(desired.retention()).equals(retentionOf(observed.retention()))
        && sameSequence(desired.admins(), observed.admins())
        && sameSequence(desired.viewerGroups(), observed.viewerGroups())
        && sameSequence(desired.editorGroups(), observed.editorGroups())
        && sameSequence(desired.adminGroups(), observed.adminGroups());
  }

  // null と空リストは同一視する。順序は区別する。
  @VisibleForTesting
  static boolean sameSequence(List<String> left, List<String> right) {
    final boolean leftEmpty = left == null || left.isEmpty();
    final boolean rightEmpty = right == null || right.isEmpty();
    if (leftEmpty || rightEmpty) {
      return leftEmpty && rightEmpty;
    }
    return left.equals(right);
  }

  private static RetentionPolicy retentionOf(RetentionPolicy retention) {
    return retention == null ? RetentionPolicy.EMPTY : retention;
  }
}
