package com.example.milestone.push;

/** プッシュ配信事業者が送信を受理しなかった。 */
public class PushDeliveryException extends RuntimeException {

  public PushDeliveryException(String message) {
    super(message);
  }

  public PushDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
