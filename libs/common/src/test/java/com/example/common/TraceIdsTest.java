/*
 * どこで: 共通ユーティリティのテスト
 * 何を: 処理中はトレース ID が見え、処理後に片付けられることを検証する
 * なぜ: プールスレッドは再利用されるため、MDC の値が残ると無関係なログに付いてしまうため
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void traceIdIsSetDuringWorkAndRemovedAfter() {
    final String seen = TraceIds.withNewTraceId(() -> MDC.get(TraceIds.MDC_KEY));

    assertThat(seen).isNotBlank();
    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
  }

  @Test
  void outerTraceIdIsRestoredEvenWhenWorkFails() {
    MDC.put(TraceIds.MDC_KEY, "outer");

    assertThatThrownBy(
            () ->
                TraceIds.withNewTraceId(
                    () -> {
                      assertThat(MDC.get(TraceIds.MDC_KEY)).isNotEqualTo("outer");
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("outer");
  }
}
