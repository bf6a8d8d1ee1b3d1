/*
 * どこで: OrgMapper サービス層
 * 何を: Tenant の desired state 登録・参照・削除要求を扱う
 * なぜ: API からの変更を store に書くだけに留め、外部同期は reconcile ループへ任せるため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.api.TenantRequest;
import com.example.orgmapper.api.TenantResponse;
import com.example.orgmapper.api.TenantStatusResponse;
import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TenantService {

  static final String STATE_ABSENT = "ABSENT";
  static final String STATE_DELETING = "DELETING";
  static final String STATE_SYNCED = "SYNCED";
  static final String STATE_NOT_SYNCED = "EXISTS_NOT_SYNCED";

  private final TenantStore tenantStore;
  private final Clock clock;

  public TenantResponse apply(String name, TenantRequest request) {
    validateName(name);
    if (request == null) {
      throw new IllegalArgumentException("request body is required");
    }
    final TenantParameters parameters =
        new TenantParameters(
            request.tenantId(),
            request.orgId(),
            request.admins(),
            request.viewerGroups(),
            request.editorGroups(),
            request.adminGroups(),
            request.retention());
    return toResponse(tenantStore.apply(name, parameters, Instant.now(clock)));
  }

  public TenantResponse get(String name) {
    validateName(name);
    return tenantStore
        .find(name)
        .map(this::toResponse)
        .orElseThrow(() -> new TenantNotFoundException(name));
  }

  public List<TenantResponse> list() {
    return tenantStore.list().stream().map(this::toResponse).toList();
  }

  public void requestDeletion(String name) {
    validateName(name);
    if (!tenantStore.requestDeletion(name, Instant.now(clock))) {
      throw new TenantNotFoundException(name);
    }
  }

  private void validateName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
  }

  private TenantResponse toResponse(TenantResource tenant) {
    final TenantParameters parameters = tenant.parameters();
    return new TenantResponse(
        tenant.name(),
        tenant.uid().toString(),
        parameters.tenantId(),
        parameters.orgId(),
        parameters.admins(),
        parameters.viewerGroups(),
        parameters.editorGroups(),
        parameters.adminGroups(),
        parameters.retention(),
        toStatus(tenant));
  }

  private TenantStatusResponse toStatus(TenantResource tenant) {
    final TenantObservation observation = tenant.observation();
    final String state = localState(tenant);
    if (observation == null) {
      return new TenantStatusResponse(state, null, null, null, null, null, null, null, null);
    }
    return new TenantStatusResponse(
        state,
        observation.tenantId(),
        observation.orgId(),
        observation.admins(),
        observation.viewerGroups(),
        observation.editorGroups(),
        observation.adminGroups(),
        observation.retention(),
        observation.lastUpdated() == null ? null : observation.lastUpdated().toString());
  }

  // Grafana へは問い合わせず、store 上の状態だけで判定する
  private String localState(TenantResource tenant) {
    if (tenant.deletionRequested()) {
      return STATE_DELETING;
    }
    if (tenant.observation() == null) {
      return STATE_ABSENT;
    }
    return TenantStateComparator.isUpToDate(tenant.parameters(), tenant.observation())
        ? STATE_SYNCED
        : STATE_NOT_SYNCED;
  }
}
