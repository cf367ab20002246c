/*
 * どこで: Milestone アプリの設定バインド
 * 何を: 変化を有意とみなすパーセンタイルの節目と差分しきい値を保持する
 * なぜ: 共有状態に触れずにテストや環境ごとに上書きできるようにするため
 */
package com.example.milestone.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.detection")
@Validated
public record ChangeDetectionProperties(
    @NotEmpty List<Double> milestones, @Positive double deltaThreshold) {

  public ChangeDetectionProperties {
    milestones = milestones == null ? List.of() : List.copyOf(milestones);
  }
}
