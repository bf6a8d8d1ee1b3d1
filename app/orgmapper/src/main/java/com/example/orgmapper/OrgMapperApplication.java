/*
 * どこで: OrgMapper アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと reconcile スケジュールをまとめて有効化するため
 */
package com.example.orgmapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class OrgMapperApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrgMapperApplication.class, args);
  }
}
