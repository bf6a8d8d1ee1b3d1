/*
 * どこで: OrgMapper reconcile ワーカー
 * 何を: スケジュールで全 Tenant を 1 件ずつ reconcile する
 * なぜ: 失敗した同期や外部 drift を次回ポーリングで自己修復させるため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "orgmapper.reconcile.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TenantReconcileWorker {

  private static final Logger logger = LoggerFactory.getLogger(TenantReconcileWorker.class);

  private final TenantStore tenantStore;
  private final TenantReconcileService reconcileService;

  @Scheduled(fixedDelayString = "${orgmapper.reconcile.poll-interval:1m}")
  public void run() {
    final List<TenantResource> tenants;
    try {
      tenants = tenantStore.list();
    } catch (RuntimeException ex) {
      logger.warn("tenant listing failed; skipping reconcile round", ex);
      return;
    }
    for (TenantResource tenant : tenants) {
      try {
        reconcileService.reconcile(tenant.name());
      } catch (RuntimeException ex) {
        // 1 件の失敗で他の Tenant の reconcile を止めない
        logger.warn("tenant reconcile failed name={}", tenant.name(), ex);
      }
    }
  }
}
