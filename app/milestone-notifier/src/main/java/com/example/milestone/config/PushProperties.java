/*
 * どこで: Milestone アプリの設定バインド
 * 何を: プッシュ配信事業者の認証情報とリクエストごとのタイムアウトを保持する
 * なぜ: 認証情報の有無で実送信を配線するかを決めるため
 */
package com.example.milestone.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.push")
public record PushProperties(String fcmCredentialsFile, Duration sendTimeout) {

  private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(10);

  public PushProperties {
    sendTimeout = sendTimeout == null ? DEFAULT_SEND_TIMEOUT : sendTimeout;
  }

  public boolean fcmConfigured() {
    return fcmCredentialsFile != null && !fcmCredentialsFile.isBlank();
  }
}
