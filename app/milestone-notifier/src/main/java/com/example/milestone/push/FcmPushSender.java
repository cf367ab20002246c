/*
 * どこで: Milestone プッシュ配信
 * 何を: Firebase Cloud Messaging のマルチキャストで通知を送る
 * なぜ: FCM が iOS/Android/Web 端末向けの本番配信事業者であるため
 */
package com.example.milestone.push;

import com.google.firebase.messaging.BatchResponse;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.MulticastMessage;
import com.google.firebase.messaging.Notification;
import com.google.firebase.messaging.SendResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FcmPushSender implements PushSender {

  private static final Logger logger = LoggerFactory.getLogger(FcmPushSender.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "FirebaseMessaging is a shared client owned by the FirebaseApp")
  private final FirebaseMessaging messaging;

  public FcmPushSender(FirebaseMessaging messaging) {
    this.messaging = messaging;
  }

  /**
   * どのトークンにも受理されなかったときだけ失敗とし、部分失敗はログに残す。失効トークンの
   * 削除はここでは行わない。
   */
  @Override
  public void sendMulti(List<String> tokens, String title, String body, Map<String, String> data) {
    if (tokens.isEmpty()) {
      throw new PushDeliveryException("no tokens to send to");
    }
    final MulticastMessage message =
        MulticastMessage.builder()
            .addAllTokens(tokens)
            .setNotification(Notification.builder().setTitle(title).setBody(body).build())
            .putAllData(data)
            .build();
    final BatchResponse response;
    try {
      response = messaging.sendEachForMulticast(message);
    } catch (FirebaseMessagingException ex) {
      throw new PushDeliveryException("fcm multicast failed: " + ex.getMessage(), ex);
    }
    if (response.getFailureCount() == 0) {
      return;
    }
    final String firstError = firstError(response);
    if (response.getSuccessCount() == 0) {
      throw new PushDeliveryException(
          "fcm rejected all " + tokens.size() + " tokens: " + firstError);
    }
    logger.warn(
        "fcm partial delivery success={} failure={} firstError={}",
        response.getSuccessCount(),
        response.getFailureCount(),
        firstError);
  }

  private String firstError(BatchResponse response) {
    return response.getResponses().stream()
        .filter(sendResponse -> !sendResponse.isSuccessful())
        .map(SendResponse::getException)
        .filter(Objects::nonNull)
        .map(Throwable::getMessage)
        .filter(Objects::nonNull)
        .findFirst()
        .orElse("unknown error");
  }
}
