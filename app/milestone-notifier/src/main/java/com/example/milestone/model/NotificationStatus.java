/*
 * どこで: Milestone ドメインモデル
 * 何を: 永続化された通知の配信状態を定義する
 * なぜ: DB の check 制約と配信ロジックで同じ状態集合を使うため
 */
package com.example.milestone.model;

import java.util.Locale;

/**
 * 前進のみの状態遷移: {@code SCHEDULED -> SENDING -> SENT | FAILED}。
 */
public enum NotificationStatus {
  SCHEDULED,
  SENDING,
  SENT,
  FAILED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationStatus fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
