/*
 * どこで: Milestone アプリの設定バインド
 * 何を: バッチ通知の予約に使う配信ウィンドウと活動時間帯を保持する
 * なぜ: 夜間の配信抑止ポリシーを環境ごとに調整できるようにするため
 */
package com.example.milestone.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.schedule")
@Validated
public record NotificationScheduleProperties(
    @NotNull Duration window,
    @Min(0) @Max(23) int wakingStartHour,
    @Min(1) @Max(24) int wakingEndHour,
    @Positive int maxAttempts,
    @NotNull Duration fallbackDelay) {

  @AssertTrue(message = "notification.schedule.window must be positive")
  public boolean isWindowPositive() {
    return window != null && !window.isZero() && !window.isNegative();
  }

  @AssertTrue(message = "notification.schedule.waking-start-hour must be before waking-end-hour")
  public boolean isWakingRangeOrdered() {
    return wakingStartHour < wakingEndHour;
  }

  public boolean isWakingHour(int hour) {
    return hour >= wakingStartHour && hour < wakingEndHour;
  }
}
