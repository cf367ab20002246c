/*
 * どこで: Milestone ドメインモデル
 * 何を: パイプラインが算出し、scheduled として挿入できる状態の通知を表す
 * なぜ: ファンアウト結果と永続化される行の形を分けるため
 */
package com.example.milestone.model;

import java.time.Instant;

public record ScheduledNotification(
    String userId,
    EntityType entityType,
    long entityId,
    String sport,
    long fixtureId,
    String statKey,
    double percentile,
    String message,
    Instant scheduledFor) {}
