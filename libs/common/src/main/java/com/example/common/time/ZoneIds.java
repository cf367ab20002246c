/*
 * どこで: 共通の時刻ヘルパー
 * 何を: ユーザー指定の IANA タイムゾーン名を解決する
 * なぜ: タイムゾーン文字列はユーザープロフィール由来で、空や不正な値がありうるため
 */
package com.example.common.time;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class ZoneIds {
  private ZoneIds() {}

  /**
   * {@code zoneName} のゾーンを返す。空または不明な名前なら UTC を返す。
   */
  public static ZoneId resolveOrUtc(String zoneName) {
    if (zoneName == null || zoneName.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(zoneName.trim());
    } catch (DateTimeException ex) {
      return ZoneOffset.UTC;
    }
  }
}
