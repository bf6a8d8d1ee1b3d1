/*
 * どこで: OrgMapper reconcile ドライバ
 * 何を: Tenant 1 件について observe → create/update/削除完了 を 1 サイクル実行する
 * なぜ: 状態遷移と observation の永続化タイミングを 1 か所で管理するため
 */
package com.example.orgmapper.service;

import com.example.common.TraceIds;
import com.example.orgmapper.model.ReconcileOutcome;
import com.example.orgmapper.model.ResourceState;
import com.example.orgmapper.model.TenantObservation;
import com.example.orgmapper.model.TenantResource;
import com.example.orgmapper.repository.TenantStore;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TenantReconcileService {

  private static final Logger logger = LoggerFactory.getLogger(TenantReconcileService.class);
  private static final String MDC_TRACE_ID = "trace_id";
  private static final String MDC_TENANT_NAME = "tenant_name";

  private final TenantStore tenantStore;
  private final TenantReconciler reconciler;
  private final OrgMapperMetrics metrics;

  public ReconcileOutcome reconcile(String name) {
    // API 経由で既に trace_id が付いていればそれを引き継ぐ
    final boolean ownsTraceId = !TraceIds.isValid(MDC.get(MDC_TRACE_ID));
    if (ownsTraceId) {
      MDC.put(MDC_TRACE_ID, TraceIds.newTraceId());
    }
    MDC.put(MDC_TENANT_NAME, name);
    try {
      final ReconcileOutcome outcome = reconcileOnce(name);
      metrics.recordReconcile(outcome.name());
      return outcome;
    } catch (RuntimeException ex) {
      metrics.recordReconcile("ERROR");
      throw ex;
    } finally {
      if (ownsTraceId) {
        MDC.remove(MDC_TRACE_ID);
      }
      MDC.remove(MDC_TENANT_NAME);
    }
  }

  private ReconcileOutcome reconcileOnce(String name) {
    final Optional<TenantResource> found = tenantStore.find(name);
    if (found.isEmpty()) {
      return ReconcileOutcome.GONE;
    }
    final TenantResource tenant = found.get();
    final ResourceState state = reconciler.observe(tenant);

    if (tenant.deletionRequested()) {
      // observe は削除中なら ABSENT を返す。その後に Delete で自身を除いた mapping を書き直す
      reconciler.delete(tenant);
      tenantStore.remove(tenant.uid());
      logger.info("tenant removed tenantId={}", tenant.parameters().tenantId());
      return ReconcileOutcome.DELETED;
    }

    return switch (state) {
      case ABSENT -> {
        final TenantObservation observation = reconciler.create(tenant);
        // Grafana が受け付けた後にだけ作成済みとして記録する
        tenantStore.saveObservation(tenant.uid(), observation);
        logger.info(
            "tenant created tenantId={} orgId={}",
            observation.tenantId(),
            observation.orgId());
        yield ReconcileOutcome.CREATED;
      }
      case EXISTS_NOT_SYNCED -> {
        final TenantObservation observation = reconciler.update(tenant);
        tenantStore.saveObservation(tenant.uid(), observation);
        logger.info(
            "tenant updated tenantId={} orgId={}",
            observation.tenantId(),
            observation.orgId());
        yield ReconcileOutcome.UPDATED;
      }
      case SYNCED -> ReconcileOutcome.NO_OP;
    };
  }
}
