/*
 * どこで: org_mapping 同期サービスのユニットテスト
 * 何を: read-modify-write で他キーを保持したまま orgMapping を置換することを検証する
 * なぜ: 無関係な SSO 設定を上書きする事故を防ぐため
 */
package com.example.orgmapper.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.orgmapper.config.GrafanaClientProperties;
import com.example.orgmapper.grafana.GrafanaIntegrationException;
import com.example.orgmapper.grafana.SsoSettingsClient;
import com.example.orgmapper.grafana.SsoSettingsNotFoundException;
import com.example.orgmapper.model.TenantMapping;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrgMappingSyncServiceTest {

  private static final GrafanaClientProperties PROPERTIES =
      new GrafanaClientProperties(null, null, null, null, null, null, null, null, null);

  @Mock private SsoSettingsClient ssoSettingsClient;

  private OrgMappingSyncService service;

  @BeforeEach
  void setUp() {
    service = new OrgMappingSyncService(ssoSettingsClient, PROPERTIES);
  }

  @Test
  void syncMappingPreservesUnrelatedKeysAndOrder() {
    final Map<String, Object> current = new LinkedHashMap<>();
    current.put("clientId", "cid");
    current.put("orgMapping", "stale:org-0:Viewer");
    current.put("extra", Map.of("nested", List.of(1, 2)));
    when(ssoSettingsClient.fetchSettings()).thenReturn(current);

    service.syncMapping(List.of(new TenantMapping("org-1", List.of("team-a"), null, null)));

    final Map<String, Object> written = captureWritten();
    assertThat(written.keySet()).containsExactly("clientId", "orgMapping", "extra");
    assertThat(written.get("clientId")).isEqualTo("cid");
    assertThat(written.get("extra")).isEqualTo(Map.of("nested", List.of(1, 2)));
    assertThat(written.get("orgMapping")).isEqualTo("team-a:org-1:Viewer");
  }

  @Test
  void syncMappingStartsFromEmptySettingsWhenProviderIsNotConfigured() {
    when(ssoSettingsClient.fetchSettings())
        .thenThrow(new SsoSettingsNotFoundException("not configured", null));

    service.syncMapping(List.of(new TenantMapping("org-1", null, List.of("eds"), null)));

    assertThat(captureWritten()).containsExactly(Map.entry("orgMapping", "eds:org-1:Editor"));
  }

  @Test
  void syncMappingWritesEmptyStringForNoTenants() {
    when(ssoSettingsClient.fetchSettings()).thenReturn(Map.of("orgMapping", "a:b:Viewer"));

    service.syncMapping(List.of());

    assertThat(captureWritten()).containsEntry("orgMapping", "");
  }

  @Test
  void syncMappingPropagatesFetchFailureWithoutWriting() {
    when(ssoSettingsClient.fetchSettings())
        .thenThrow(
            new GrafanaIntegrationException(GrafanaIntegrationException.Reason.TIMEOUT, "timeout"));

    assertThatThrownBy(() -> service.syncMapping(List.of()))
        .isInstanceOf(GrafanaIntegrationException.class);
    verify(ssoSettingsClient, never()).replaceSettings(any());
  }

  @Test
  void syncMappingPropagatesReplaceFailure() {
    when(ssoSettingsClient.fetchSettings()).thenReturn(new LinkedHashMap<>());
    doThrow(
            new GrafanaIntegrationException(
                GrafanaIntegrationException.Reason.REJECTED, "bad request"))
        .when(ssoSettingsClient)
        .replaceSettings(any());

    assertThatThrownBy(() -> service.syncMapping(List.of()))
        .isInstanceOf(GrafanaIntegrationException.class)
        .extracting(ex -> ((GrafanaIntegrationException) ex).reason())
        .isEqualTo(GrafanaIntegrationException.Reason.REJECTED);
  }

  @Test
  void currentMappingHandlesMissingProviderAndNonStringValues() {
    when(ssoSettingsClient.fetchSettings())
        .thenThrow(new SsoSettingsNotFoundException("not configured", null))
        .thenReturn(Map.of("orgMapping", 42))
        .thenReturn(Map.of("orgMapping", "a:org-1:Viewer"));

    assertThat(service.currentMapping()).isEmpty();
    assertThat(service.currentMapping()).contains("");
    assertThat(service.currentMapping()).contains("a:org-1:Viewer");
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> captureWritten() {
    final ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
    verify(ssoSettingsClient).replaceSettings(captor.capture());
    return captor.getValue();
  }
}
