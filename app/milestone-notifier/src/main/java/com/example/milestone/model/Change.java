/*
 * どこで: Milestone ドメインモデル
 * 何を: fixture 内の 1 エンティティ 1 スタッツのパーセンタイル変動を表す
 * なぜ: 検出のたびに生成されパイプラインで消費される値で、永続化しないため
 */
package com.example.milestone.model;

/** アーカイブ済みスナップショットがまだ無いスタッツでは {@code oldPercentile} は null。 */
public record Change(
    long fixtureId,
    EntityType entityType,
    long entityId,
    String sport,
    int season,
    long leagueId,
    String statKey,
    Double oldPercentile,
    double newPercentile,
    int sampleSize) {

  public boolean hasBaseline() {
    return oldPercentile != null;
  }
}
