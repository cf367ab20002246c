package com.example.milestone.service;

/** パーセンタイル差分の取得に失敗し、その fixture の実行を続けられない。 */
public class ChangeDetectionException extends RuntimeException {

  public ChangeDetectionException(long fixtureId, Throwable cause) {
    super("detect percentile changes failed fixtureId=" + fixtureId, cause);
  }
}
