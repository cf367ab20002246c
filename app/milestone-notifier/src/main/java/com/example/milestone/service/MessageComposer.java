/*
 * どこで: Milestone サービス層
 * 何を: パーセンタイル変動のプッシュ本文を組み立てる
 * なぜ: バッチ経路とリアルタイム経路で同じ文面にするため
 */
package com.example.milestone.service;

import com.example.milestone.model.Change;

public final class MessageComposer {
  private MessageComposer() {}

  public static String compose(String entityName, String statDisplayName, Change change) {
    return compose(entityName, statDisplayName, change.newPercentile());
  }

  /** {@code "<name> is now <N><suffix> percentile in <stat>"}。N はパーセンタイルの切り捨て値。 */
  public static String compose(String entityName, String statDisplayName, double percentile) {
    final int rank = (int) percentile;
    return entityName + " is now " + rank + ordinalSuffix(rank) + " percentile in " + statDisplayName;
  }

  public static String ordinalSuffix(int n) {
    final int lastTwo = Math.abs(n % 100);
    if (lastTwo >= 11 && lastTwo <= 13) {
      return "th";
    }
    return switch (lastTwo % 10) {
      case 1 -> "st";
      case 2 -> "nd";
      case 3 -> "rd";
      default -> "th";
    };
  }
}
