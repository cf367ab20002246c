/*
 * どこで: Milestone サービス層
 * 何を: 試合後のウィンドウ内かつフォロワーの活動時間帯に収まる配信時刻を選ぶ
 * なぜ: プッシュをウィンドウ内に分散させ、現地の夜間には配信しないため
 */
package com.example.milestone.service;

import com.example.common.time.ZoneIds;
import com.example.milestone.config.NotificationScheduleProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.random.RandomGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryScheduler {

  private final NotificationScheduleProperties properties;
  private final RandomGenerator randomGenerator;

  /**
   * {@code [matchTime, matchTime + window)} から乱数で時刻を引き、現地の活動時間帯に入るまで
   * 繰り返す。{@code maxAttempts} 回外れたら {@code matchTime + fallbackDelay} の現地日付の
   * 活動開始時刻に乱数の分を足した時刻にフォールバックする。不明なタイムゾーンは UTC として扱う。
   */
  public Instant scheduleDelivery(Instant matchTime, String timezone) {
    final ZoneId zone = ZoneIds.resolveOrUtc(timezone);
    final long windowNanos = properties.window().toNanos();
    for (int attempt = 0; attempt < properties.maxAttempts(); attempt++) {
      final Instant candidate = matchTime.plusNanos(randomGenerator.nextLong(windowNanos));
      if (properties.isWakingHour(candidate.atZone(zone).getHour())) {
        return candidate;
      }
    }
    final LocalDate fallbackDay = matchTime.plus(properties.fallbackDelay()).atZone(zone).toLocalDate();
    return fallbackDay
        .atTime(properties.wakingStartHour(), randomGenerator.nextInt(60))
        .atZone(zone)
        .toInstant();
  }
}
