/*
 * どこで: OrgMapper reconcile エンジン
 * 何を: Tenant 1 件分の observe / create / update / delete を行う
 * なぜ: 全 Tenant の集合から org_mapping を毎回再計算し、冪等に収束させるため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.grafana.GrafanaIntegrationException;
import com.example.orgmapper.mapping.OrgMappingCodec;
import com.example.orgmapper.model.ManagedResource;
import com.example.orgmapper.model.ResourceState;
import com.example.orgmapper.model.TenantMapping;
import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantParameters;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import com.example.orgmapper.repository.TenantStoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-tenant state machine. Only {@link #create} propagates synchronisation failures; update,
 * delete and the sync performed while observing a deleting tenant log and carry on, so the next
 * scheduled cycle retries them.
 */
@Service
@RequiredArgsConstructor
public class TenantReconciler {

  private static final Logger logger = LoggerFactory.getLogger(TenantReconciler.class);

  static final String ERR_NOT_TENANT = "managed resource is not a Tenant";

  private final TenantStore tenantStore;
  private final OrgMappingSyncService syncService;
  private final TenantUniquenessGuard uniquenessGuard;
  private final OrgMapperMetrics metrics;
  private final Clock clock;

  public ResourceState observe(ManagedResource resource) {
    final TenantResource tenant = asTenant(resource);
    if (tenant.observation() == null) {
      return ResourceState.ABSENT;
    }
    if (tenant.deletionRequested()) {
      // Delete の代わりにここで Grafana から外し、ABSENT を返して削除を完了させる
      syncBestEffort(tenant, true, "observe_delete");
      return ResourceState.ABSENT;
    }
    boolean upToDate = TenantStateComparator.isUpToDate(tenant.parameters(), tenant.observation());
    if (upToDate && tenant.parameters().declaresViewerOrEditorGroups()) {
      try {
        if (isDrifted(tenant.parameters())) {
          logger.info(
              "grafana org mapping drift detected; triggering resync tenant={}", tenant.name());
          metrics.recordDriftDetected();
          upToDate = false;
        }
      } catch (RuntimeException ex) {
        // Grafana 不達時に無限ループさせないよう drift 判定の失敗は無視する
        logger.debug("grafana drift check failed tenant={}", tenant.name(), ex);
      }
    }
    return upToDate ? ResourceState.SYNCED : ResourceState.EXISTS_NOT_SYNCED;
  }

  /**
   * Registers a new tenant. Fails with {@link TenantConflictException} when another tenant already
   * owns the tenantId, and with the sync failure itself when Grafana does not accept the mapping.
   * The returned observation must only be persisted after this method returns.
   */
  public TenantObservation create(ManagedResource resource) {
    final TenantResource tenant = asTenant(resource);
    uniquenessGuard.check(tenant);
    final TenantObservation observation = observationOf(tenant.parameters());
    try {
      sync(tenant, false);
    } catch (GrafanaIntegrationException | TenantStoreException ex) {
      metrics.recordSyncError("create", reasonOf(ex));
      throw ex;
    }
    return observation;
  }

  /** Refreshes the observation; the Grafana sync is best effort. */
  public TenantObservation update(ManagedResource resource) {
    final TenantResource tenant = asTenant(resource);
    final TenantObservation observation = observationOf(tenant.parameters());
    syncBestEffort(tenant, false, "update");
    return observation;
  }

  /** Rebuilds the mapping without this tenant; failures never block the deletion. */
  public void delete(ManagedResource resource) {
    syncBestEffort(asTenant(resource), true, "delete");
  }

  private boolean isDrifted(TenantParameters parameters) {
    final String orgMapping = syncService.currentMapping().orElse("");
    return !OrgMappingCodec.contains(orgMapping, parameters.orgId());
  }

  private void syncBestEffort(TenantResource tenant, boolean excludeSelf, String operation) {
    try {
      sync(tenant, excludeSelf);
    } catch (RuntimeException ex) {
      metrics.recordSyncError(operation, reasonOf(ex));
      logger.info(
          "failed to sync grafana org mapping operation={} tenant={}",
          operation,
          tenant.name(),
          ex);
    }
  }

  private void sync(TenantResource tenant, boolean excludeSelf) {
    final List<TenantResource> all = tenantStore.list();
    final List<TenantMapping> mappings = new ArrayList<>(all.size());
    for (TenantResource other : all) {
      if (excludeSelf && other.uid().equals(tenant.uid())) {
        continue;
      }
      mappings.add(TenantMapping.from(other.parameters()));
    }
    syncService.syncMapping(mappings);
  }

  private TenantObservation observationOf(TenantParameters parameters) {
    return TenantObservation.of(parameters, Instant.now(clock));
  }

  private static TenantResource asTenant(ManagedResource resource) {
    if (resource instanceof TenantResource tenant) {
      return tenant;
    }
    throw new TenantTypeMismatchException(
        ERR_NOT_TENANT + ": " + (resource == null ? "null" : resource.kind()));
  }

  private static String reasonOf(RuntimeException ex) {
    if (ex instanceof GrafanaIntegrationException integration) {
      return integration.reason().name();
    }
    if (ex instanceof TenantStoreException) {
      return "STORE";
    }
    return "UNKNOWN";
  }
}
