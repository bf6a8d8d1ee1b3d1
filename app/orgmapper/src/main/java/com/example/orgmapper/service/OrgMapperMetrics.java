/*
 * どこで: OrgMapper サービス層
 * 何を: reconcile 結果・Grafana 同期失敗・drift 検知のメトリクスを記録する
 * なぜ: 外部同期の失敗が握りつぶされても Prometheus から観測できるようにするため
 */
package com.example.orgmapper.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class OrgMapperMetrics {

  private static final String METRIC_RECONCILE_TOTAL = "orgmapper.reconcile.total";
  private static final String METRIC_SYNC_ERROR_TOTAL = "orgmapper.sync.error.total";
  private static final String METRIC_DRIFT_DETECTED_TOTAL = "orgmapper.drift.detected.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> reconcileCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> syncErrorCounters = new ConcurrentHashMap<>();
  private final Counter driftDetectedCounter;

  public OrgMapperMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.driftDetectedCounter =
        Counter.builder(METRIC_DRIFT_DETECTED_TOTAL)
            .description("Tenants whose org mapping entry was missing in Grafana")
            .register(meterRegistry);
  }

  public void recordReconcile(String outcome) {
    reconcileCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_RECONCILE_TOTAL)
                    .description("Tenant reconcile cycle outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSyncError(String operation, String reason) {
    final String key = operation + "|" + reason;
    syncErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_SYNC_ERROR_TOTAL)
                    .description("Grafana org mapping sync failures")
                    .tags(Tags.of("operation", operation, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDriftDetected() {
    driftDetectedCounter.increment();
  }
}
