/*
 * どこで: Milestone アプリの設定バインド
 * 何を: リアルタイムリスナーのチャネル名、再接続バックオフ、ハンドラプールの大きさを保持する
 * なぜ: 不正なバックオフで再接続が空回りしないよう起動時に検証するため
 */
package com.example.milestone.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.listener")
@Validated
public record MilestoneListenerProperties(
    boolean enabled,
    @NotBlank @Pattern(regexp = "[a-z_][a-z0-9_]*") String channel,
    @NotNull Duration initialBackoff,
    @NotNull Duration maxBackoff,
    @NotNull Duration pollTimeout,
    @Positive int handlerPoolSize,
    @Positive int handlerQueueCapacity) {

  @AssertTrue(message = "notification.listener.initial-backoff must be positive")
  public boolean isInitialBackoffPositive() {
    return isPositiveDuration(initialBackoff);
  }

  @AssertTrue(message = "notification.listener.max-backoff must not be shorter than initial-backoff")
  public boolean isMaxBackoffOrdered() {
    return initialBackoff != null && maxBackoff != null && maxBackoff.compareTo(initialBackoff) >= 0;
  }

  @AssertTrue(message = "notification.listener.poll-timeout must be positive")
  public boolean isPollTimeoutPositive() {
    return isPositiveDuration(pollTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull 側で報告する
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
