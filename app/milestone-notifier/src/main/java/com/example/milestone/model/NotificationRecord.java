/*
 * どこで: Milestone ドメインモデル
 * 何を: notifications テーブルの 1 行のスナップショットを表す
 * なぜ: 確保処理と配信ワーカーで共有するため
 */
package com.example.milestone.model;

import java.time.Instant;

public record NotificationRecord(
    long id,
    String userId,
    EntityType entityType,
    long entityId,
    String sport,
    Long fixtureId,
    String statKey,
    double percentile,
    String message,
    NotificationStatus status,
    Instant scheduledFor,
    Instant sentAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {}
