/*
 * どこで: 共通ユーティリティ
 * 何を: トレース ID を発行し、SLF4J の MDC で処理単位に割り当てる
 * なぜ: プールスレッドへ渡した処理には引き継げるリクエスト文脈が無いため
 */
package com.example.common;

import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 新しいトレース ID を {@link #MDC_KEY} に入れて {@code work} を実行する。元の値があれば
   * 実行後に戻す。
   */
  public static <T> T withNewTraceId(Supplier<T> work) {
    final String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, newTraceId());
    try {
      return work.get();
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }
}
