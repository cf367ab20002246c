/*
 * どこで: Milestone プッシュ配信
 * 何を: 配信事業者が未設定のときに使う送信実装
 * なぜ: 常に成功させ、行を sent へ進めて残りのフローを変えないため
 */
package com.example.milestone.push;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NoOpPushSender implements PushSender {

  private static final Logger logger = LoggerFactory.getLogger(NoOpPushSender.class);

  @Override
  public void sendMulti(List<String> tokens, String title, String body, Map<String, String> data) {
    logger.debug(
        "push skipped (no provider configured) tokens={} title={} body={}",
        tokens.size(),
        title,
        body);
  }
}
