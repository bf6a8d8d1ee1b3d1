/*
 * どこで: OrgMapper サービス層
 * 何を: Grafana SSO 設定の orgMapping を read-modify-write で置き換える
 * なぜ: orgMapping 以外のプロバイダ設定を壊さずに全 Tenant 分を反映するため
 */
package com.example.orgmapper.service;

import com.example.orgmapper.config.GrafanaClientProperties;
import com.example.orgmapper.grafana.SsoSettingsClient;
import com.example.orgmapper.grafana.SsoSettingsNotFoundException;
import com.example.orgmapper.mapping.OrgMappingCodec;
import com.example.orgmapper.model.TenantMapping;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrgMappingSyncService {

  private static final Logger logger = LoggerFactory.getLogger(OrgMappingSyncService.class);

  private final SsoSettingsClient ssoSettingsClient;
  private final GrafanaClientProperties properties;

  /**
   * Writes the mapping computed from {@code tenants} into the provider settings. Keys other than
   * the mapping key are sent back exactly as they were read. There is no locking: a concurrent
   * writer may overwrite this result, and the next cycle recomputes the full mapping.
   */
  public void syncMapping(List<TenantMapping> tenants) {
    final Map<String, Object> settings = fetchOrEmpty();
    final String orgMapping = OrgMappingCodec.encode(tenants);
    logger.debug(
        "syncing grafana org mapping tenants={} orgMapping={}", tenants.size(), orgMapping);
    settings.put(properties.mappingKey(), orgMapping);
    ssoSettingsClient.replaceSettings(settings);
  }

  /** Current mapping value; empty when the provider has never been configured. */
  public Optional<String> currentMapping() {
    final Map<String, Object> settings;
    try {
      settings = ssoSettingsClient.fetchSettings();
    } catch (SsoSettingsNotFoundException ex) {
      return Optional.empty();
    }
    final Object value = settings.get(properties.mappingKey());
    return Optional.of(value instanceof String mapping ? mapping : "");
  }

  private Map<String, Object> fetchOrEmpty() {
    try {
      return new LinkedHashMap<>(ssoSettingsClient.fetchSettings());
    } catch (SsoSettingsNotFoundException ex) {
      logger.info("sso provider not configured yet; starting from empty settings");
      return new LinkedHashMap<>();
    }
  }
}
