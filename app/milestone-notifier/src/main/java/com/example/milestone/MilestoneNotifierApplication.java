/*
 * どこで: Milestone notifier の起動エントリ
 * 何を: Spring を起動し、スケジューリングと設定プロパティのスキャンを有効化する
 * なぜ: 配信ワーカーとマイルストーンリスナーをプロセスの寿命の間動かすため
 */
package com.example.milestone;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class MilestoneNotifierApplication {

  public static void main(String[] args) {
    SpringApplication.run(MilestoneNotifierApplication.class, args);
  }
}
