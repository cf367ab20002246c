/*
 * どこで: Milestone リアルタイムリスナー
 * 何を: publish/subscribe チャネルを購読中の 1 本の接続を表す
 * なぜ: DB 無しで再接続ループを検証できるようにするため
 */
package com.example.milestone.listener;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

public interface ListenSession extends AutoCloseable {

  /**
   * 最大 {@code timeout} の間、発行済みペイロードを待って発行順に返す。何も届かなければ空リストを
   * 返す。
   *
   * @throws SQLException 接続が失われたとき
   */
  List<String> awaitPayloads(Duration timeout) throws SQLException;

  @Override
  void close();
}
