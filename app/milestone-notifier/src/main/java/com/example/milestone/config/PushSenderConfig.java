/*
 * どこで: Milestone アプリのインフラ設定
 * 何を: プッシュ送信の実装を選択する
 * なぜ: 認証情報が設定されたときだけ FCM の実送信を配線するため
 */
package com.example.milestone.config;

import com.example.milestone.push.FcmPushSender;
import com.example.milestone.push.NoOpPushSender;
import com.example.milestone.push.PushSender;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PushSenderConfig {

  private static final Logger logger = LoggerFactory.getLogger(PushSenderConfig.class);
  private static final String FIREBASE_APP_NAME = "milestone-notifier";

  @Bean
  public PushSender pushSender(PushProperties properties) {
    if (!properties.fcmConfigured()) {
      logger.info("push delivery disabled (notification.push.fcm-credentials-file is empty)");
      return new NoOpPushSender();
    }
    final FirebaseApp app = initializeFirebase(properties);
    logger.info("push delivery enabled provider=fcm app={}", app.getName());
    return new FcmPushSender(FirebaseMessaging.getInstance(app));
  }

  private FirebaseApp initializeFirebase(PushProperties properties) {
    final String credentialsFile = properties.fcmCredentialsFile();
    // SDK に呼び出し単位のタイムアウトが無いため、HTTP 層で各送信の上限を決める
    final int timeoutMillis = Math.toIntExact(properties.sendTimeout().toMillis());
    try (InputStream in = Files.newInputStream(Path.of(credentialsFile))) {
      final FirebaseOptions options =
          FirebaseOptions.builder()
              .setCredentials(GoogleCredentials.fromStream(in))
              .setConnectTimeout(timeoutMillis)
              .setReadTimeout(timeoutMillis)
              .build();
      return FirebaseApp.initializeApp(options, FIREBASE_APP_NAME);
    } catch (IOException ex) {
      throw new IllegalStateException("failed to load FCM credentials file=" + credentialsFile, ex);
    }
  }
}
