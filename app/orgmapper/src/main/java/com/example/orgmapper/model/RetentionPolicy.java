/*
 * どこで: OrgMapper ドメインモデル
 * 何を: シグナル種別ごとの保持期間を保持する
 * なぜ: 値は解釈せずにそのまま status へ引き渡すため
 */
package com.example.orgmapper.model;

public record RetentionPolicy(String logs, String metrics, String traces, String profiles) {

  public static final RetentionPolicy EMPTY = new RetentionPolicy("", "", "", "");

  public RetentionPolicy {
    logs = logs == null ? "" : logs;
    metrics = metrics == null ? "" : metrics;
    traces = traces == null ? "" : traces;
    profiles = profiles == null ? "" : profiles;
  }
}
