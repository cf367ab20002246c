/*
 * どこで: common のイベント payload 定義
 * 何を: パーセンタイルのトリガーが milestone_reached チャネルへ発行するペイロード
 * なぜ: DB トリガーとリスナーで同一の snake_case JSON 形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MilestoneEvent(
        String entityType,
        long entityId,
        String sport,
        int season,
        String statKey,
        double percentile,
        @JsonProperty("ts") long timestamp) {
}
