/*
 * どこで: OrgMapper の Grafana 連携設定
 * 何を: Grafana HTTP API 呼び出し専用の RestClient を組み立てる
 * なぜ: ベースパス補正と認証ヘッダ付与を 1 か所に閉じ込めるため
 */
package com.example.orgmapper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(GrafanaClientProperties.class)
public class GrafanaClientConfig {

  private static final String API_PATH = "/api";

  @Bean
  RestClient grafanaRestClient(RestClient.Builder builder, GrafanaClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return configure(builder, properties).requestFactory(requestFactory).build();
  }

  /** Applies base URL and credentials; shared with tests that bind a mock server. */
  public static RestClient.Builder configure(
      RestClient.Builder builder, GrafanaClientProperties properties) {
    builder.baseUrl(resolveApiBaseUrl(properties.baseUrl()));
    builder.messageConverters(
        converters -> converters.replaceAll(GrafanaClientConfig::withExactDecimals));
    final String authorization = authorizationHeader(properties);
    if (authorization != null) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    return builder;
  }

  /**
   * Normalises the configured Grafana URL so that it always ends with {@code /api}: an empty path
   * becomes {@code /api}, a path already ending in {@code /api} is kept, anything else gets {@code
   * /api} appended.
   */
  public static String resolveApiBaseUrl(String grafanaUrl) {
    final URI uri;
    try {
      uri = new URI(grafanaUrl.trim());
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("cannot parse grafana URL", ex);
    }
    if (uri.getScheme() == null || uri.getRawAuthority() == null) {
      throw new IllegalArgumentException("cannot parse grafana URL: " + grafanaUrl);
    }
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    if (path.isEmpty()) {
      path = API_PATH;
    } else if (!path.endsWith(API_PATH)) {
      path = path + API_PATH;
    }
    return uri.getScheme() + "://" + uri.getRawAuthority() + path;
  }

  // 他キーの小数 (1.10 など) を Double に丸めず、PUT でそのまま書き戻す
  private static HttpMessageConverter<?> withExactDecimals(HttpMessageConverter<?> converter) {
    if (converter instanceof MappingJackson2HttpMessageConverter jackson) {
      return new MappingJackson2HttpMessageConverter(
          jackson
              .getObjectMapper()
              .copy()
              .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }
    return converter;
  }

  private static String authorizationHeader(GrafanaClientProperties properties) {
    if (properties.basicAuth()) {
      return "Basic "
          + HttpHeaders.encodeBasicAuth(
              properties.username(), properties.password(), StandardCharsets.UTF_8);
    }
    if (!properties.token().isBlank()) {
      return "Bearer " + properties.token();
    }
    return null;
  }
}
