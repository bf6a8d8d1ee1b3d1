/*
 * どこで: Grafana 連携クライアント
 * 何を: SSO プロバイダ設定の取得と全置換を行う
 * なぜ: HTTP ステータスを連携例外へ正規化し、呼び出し側の分岐を単純にするため
 */
package com.example.orgmapper.grafana;

import com.example.orgmapper.config.GrafanaClientProperties;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@RequiredArgsConstructor
public class GrafanaSsoSettingsClient implements SsoSettingsClient {

  private final RestClient grafanaRestClient;
  private final GrafanaClientProperties properties;

  @Override
  public Map<String, Object> fetchSettings() {
    final SsoSettingsResponse response;
    try {
      response =
          grafanaRestClient
              .get()
              .uri(properties.settingsPath(), properties.provider())
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(SsoSettingsResponse.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        throw new SsoSettingsNotFoundException(
            "sso provider is not configured: " + properties.provider(), ex);
      }
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RuntimeException ex) {
      throw new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.INVALID_RESPONSE,
          "grafana sso settings parse failed",
          ex);
    }
    return toSettings(response);
  }

  @Override
  public void replaceSettings(Map<String, Object> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("settings is required");
    }
    try {
      grafanaRestClient
          .put()
          .uri(properties.settingsPath(), properties.provider())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new SsoSettingsUpdateRequest(properties.provider(), settings))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private Map<String, Object> toSettings(SsoSettingsResponse response) {
    if (response == null || response.settings() == null) {
      return new LinkedHashMap<>();
    }
    if (!(response.settings() instanceof Map<?, ?> raw)) {
      throw new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.INVALID_RESPONSE, "sso settings is not a map");
    }
    final Map<String, Object> settings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      settings.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return settings;
  }

  private GrafanaIntegrationException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.UNAUTHORIZED, "grafana rejected credentials", ex);
    }
    if (status == 403) {
      return new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.FORBIDDEN, "grafana denied access", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.BAD_GATEWAY, "grafana server error", ex);
    }
    return new GrafanaIntegrationException(
        GrafanaIntegrationException.Reason.REJECTED,
        "grafana rejected sso settings request status=" + status,
        ex);
  }

  private GrafanaIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new GrafanaIntegrationException(
          GrafanaIntegrationException.Reason.TIMEOUT, "grafana request timeout", ex);
    }
    return new GrafanaIntegrationException(
        GrafanaIntegrationException.Reason.BAD_GATEWAY, "grafana connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
