/*
 * どこで: Milestone プッシュ配信
 * 何を: 1 件のメッセージを複数の端末トークンへ届ける能力を定義する
 * なぜ: 実配信事業者の有無にかかわらずパイプラインの振る舞いを揃えるため
 */
package com.example.milestone.push;

import java.util.List;
import java.util.Map;

public interface PushSender {

  /**
   * 1 件の通知を全トークンへ送る。
   *
   * @throws PushDeliveryException 配信事業者がバッチを拒否したとき
   */
  void sendMulti(List<String> tokens, String title, String body, Map<String, String> data);
}
