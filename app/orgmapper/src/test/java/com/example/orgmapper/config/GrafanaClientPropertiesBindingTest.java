/*
 * どこで: Grafana 設定バインドのテスト
 * 何を: 既定値と Duration 表記のバインドを検証する
 * なぜ: 設定漏れがあっても generic_oauth / orgMapping を前提に起動できることを保証するため
 */
package com.example.orgmapper.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class GrafanaClientPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDefaultsWhenPropertiesAreMissing() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final GrafanaClientProperties properties = context.getBean(GrafanaClientProperties.class);
          assertThat(properties.baseUrl()).isEqualTo("http://grafana:3000");
          assertThat(properties.provider()).isEqualTo("generic_oauth");
          assertThat(properties.mappingKey()).isEqualTo("orgMapping");
          assertThat(properties.settingsPath()).isEqualTo("/v1/sso-settings/{provider}");
          assertThat(properties.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(properties.readTimeout()).isEqualTo(Duration.ofSeconds(10));
          assertThat(properties.basicAuth()).isFalse();
        });
  }

  @Test
  void bindsConfiguredValues() {
    contextRunner
        .withPropertyValues(
            "grafana.base-url=https://grafana.example.com/grafana",
            "grafana.username=admin",
            "grafana.password=secret",
            "grafana.provider=azuread",
            "grafana.mapping-key=org_mapping",
            "grafana.connect-timeout=2s",
            "grafana.read-timeout=500ms")
        .run(
            context -> {
              final GrafanaClientProperties properties =
                  context.getBean(GrafanaClientProperties.class);
              assertThat(properties.baseUrl()).isEqualTo("https://grafana.example.com/grafana");
              assertThat(properties.provider()).isEqualTo("azuread");
              assertThat(properties.mappingKey()).isEqualTo("org_mapping");
              assertThat(properties.connectTimeout()).isEqualTo(Duration.ofSeconds(2));
              assertThat(properties.readTimeout()).isEqualTo(Duration.ofMillis(500));
              assertThat(properties.basicAuth()).isTrue();
            });
  }

  @Configuration
  @EnableConfigurationProperties(GrafanaClientProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
