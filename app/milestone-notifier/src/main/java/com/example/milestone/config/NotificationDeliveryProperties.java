/*
 * どこで: Milestone アプリの設定バインド
 * 何を: 配信ワーカーのポーリングとバッチ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.milestone.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @NotBlank String title,
    @Positive int errorMessageMaxLength) {}
