/*
 * どこで: OrgMapper サービス層
 * 何を: Create 前に tenantId の重複を検査する
 * なぜ: 同じ tenantId を持つ Tenant が org_mapping に二重登録されるのを防ぐため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TenantUniquenessGuard {

  static final String DUPLICATE_TENANT_MESSAGE = "tenant with this tenantId already exists";

  private final TenantStore tenantStore;

  // 同時に走る Create 同士の競合までは検出しない
  public void check(TenantResource candidate) {
    final String tenantId = candidate.parameters().tenantId();
    for (TenantResource other : tenantStore.list()) {
      if (other.uid().equals(candidate.uid())) {
        continue;
      }
      if (Objects.equals(other.parameters().tenantId(), tenantId)) {
        throw new TenantConflictException(DUPLICATE_TENANT_MESSAGE + ": " + tenantId);
      }
    }
  }
}
