package com.example.orgmapper.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grafana")
public record GrafanaClientProperties(
    String baseUrl,
    String token,
    String username,
    String password,
    String provider,
    String mappingKey,
    String settingsPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public GrafanaClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://grafana:3000" : baseUrl;
    token = token == null ? "" : token.trim();
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    provider = provider == null || provider.isBlank() ? "generic_oauth" : provider;
    mappingKey = mappingKey == null || mappingKey.isBlank() ? "orgMapping" : mappingKey;
    settingsPath =
        settingsPath == null || settingsPath.isBlank()
            ? "/v1/sso-settings/{provider}"
            : settingsPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  public boolean basicAuth() {
    return !username.isBlank() && !password.isBlank();
  }

  // 認証情報をログへ出さないよう toString を上書きする
  @Override
  public String toString() {
    return "GrafanaClientProperties[baseUrl="
        + baseUrl
        + ", provider="
        + provider
        + ", mappingKey="
        + mappingKey
        + ", basicAuth="
        + basicAuth()
        + "]";
  }
}
