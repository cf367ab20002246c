/*
 * どこで: Milestone ドメインモデル
 * 何を: ユーザーがフォローできるエンティティの種別を定義する
 * なぜ: DB では小文字のテキスト('player' / 'team')で保存されるため
 */
package com.example.milestone.model;

import java.util.Locale;

public enum EntityType {
  PLAYER("player"),
  TEAM("team");

  private final String dbValue;

  EntityType(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static EntityType fromDbValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("entity type must not be null");
    }
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "player" -> PLAYER;
      case "team" -> TEAM;
      default -> throw new IllegalArgumentException("unknown entity type: " + value);
    };
  }
}
