package com.example.milestone.model;

/** 1 回の配信バッチの送信成功/失敗件数。 */
public record DispatchResult(int sent, int failed) {

  public static final DispatchResult EMPTY = new DispatchResult(0, 0);

  public boolean isEmpty() {
    return sent + failed == 0;
  }
}
