/*
 * どこで: Milestone データアクセス
 * 何を: バッチ挿入が途中で止まったことを通知する
 * なぜ: 失敗前にコミット済みの行数を呼び出し側が知る必要があるため
 */
package com.example.milestone.repository;

public class NotificationPersistenceException extends RuntimeException {

  private final int insertedCount;

  public NotificationPersistenceException(int insertedCount, Throwable cause) {
    super("notification insert failed after " + insertedCount + " rows", cause);
    this.insertedCount = insertedCount;
  }

  public int insertedCount() {
    return insertedCount;
  }
}
