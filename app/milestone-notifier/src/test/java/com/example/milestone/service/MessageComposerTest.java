/*
 * どこで: Milestone 文面生成の単体テスト
 * 何を: 序数の接尾辞とパーセンタイルの切り捨てを検証する
 * なぜ: 利用者がロック画面でこの文面をそのまま目にするため
 */
package com.example.milestone.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MessageComposerTest {

  @Test
  void ordinalSuffixFollowsEnglishRules() {
    assertThat(MessageComposer.ordinalSuffix(1)).isEqualTo("st");
    assertThat(MessageComposer.ordinalSuffix(2)).isEqualTo("nd");
    assertThat(MessageComposer.ordinalSuffix(3)).isEqualTo("rd");
    assertThat(MessageComposer.ordinalSuffix(4)).isEqualTo("th");
    assertThat(MessageComposer.ordinalSuffix(11)).isEqualTo("th");
    assertThat(MessageComposer.ordinalSuffix(12)).isEqualTo("th");
    assertThat(MessageComposer.ordinalSuffix(13)).isEqualTo("th");
    assertThat(MessageComposer.ordinalSuffix(21)).isEqualTo("st");
    assertThat(MessageComposer.ordinalSuffix(92)).isEqualTo("nd");
    assertThat(MessageComposer.ordinalSuffix(100)).isEqualTo("th");
    assertThat(MessageComposer.ordinalSuffix(101)).isEqualTo("st");
    assertThat(MessageComposer.ordinalSuffix(111)).isEqualTo("th");
  }

  @Test
  void composeTruncatesThePercentile() {
    assertThat(MessageComposer.compose("Bukayo Saka", "Goals", 95.9d))
        .isEqualTo("Bukayo Saka is now 95th percentile in Goals");
    assertThat(MessageComposer.compose("Arsenal", "Clean Sheets", 91.2d))
        .isEqualTo("Arsenal is now 91st percentile in Clean Sheets");
  }
}
