package com.example.milestone.listener;

import java.sql.SQLException;

/** {@code channel} を購読済みの専用接続を開く。 */
public interface ListenSessionFactory {

  ListenSession open(String channel) throws SQLException;
}
