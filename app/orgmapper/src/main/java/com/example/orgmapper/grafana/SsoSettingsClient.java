package com.example.orgmapper.grafana;

import java.util.Map;

/** Read and write access to one SSO provider's settings object. */
public interface SsoSettingsClient {

  /**
   * Returns the provider settings in their original key order.
   *
   * @throws SsoSettingsNotFoundException when the provider has never been configured
   * @throws GrafanaIntegrationException on transport, auth or payload failures
   */
  Map<String, Object> fetchSettings();

  /**
   * Replaces the whole settings object.
   *
   * @throws GrafanaIntegrationException when Grafana rejects the request or cannot be reached
   */
  void replaceSettings(Map<String, Object> settings);
}
