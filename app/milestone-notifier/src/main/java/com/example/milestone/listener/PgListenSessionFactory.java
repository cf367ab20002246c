/*
 * どこで: Milestone リアルタイムリスナー
 * 何を: 専用の PostgreSQL 接続を開き、その上で LISTEN を発行する
 * なぜ: プール接続だと Hikari に回収され、購読が黙って失われるため
 */
package com.example.milestone.listener;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PgListenSessionFactory implements ListenSessionFactory {

  private static final Logger logger = LoggerFactory.getLogger(PgListenSessionFactory.class);

  private final DataSourceProperties dataSourceProperties;

  @Override
  public ListenSession open(String channel) throws SQLException {
    final Connection connection =
        DriverManager.getConnection(
            dataSourceProperties.determineUrl(),
            dataSourceProperties.determineUsername(),
            dataSourceProperties.determinePassword());
    try {
      connection.setAutoCommit(true);
      try (Statement statement = connection.createStatement()) {
        // channel は起動時に識別子パターンで検証済み
        statement.execute("LISTEN " + channel);
      }
      return new PgListenSession(connection, connection.unwrap(PGConnection.class));
    } catch (SQLException | RuntimeException ex) {
      closeQuietly(connection);
      throw ex;
    }
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException ex) {
      logger.debug("listen connection close failed", ex);
    }
  }

  private static final class PgListenSession implements ListenSession {

    private final Connection connection;
    private final PGConnection pgConnection;

    private PgListenSession(Connection connection, PGConnection pgConnection) {
      this.connection = connection;
      this.pgConnection = pgConnection;
    }

    @Override
    public List<String> awaitPayloads(Duration timeout) throws SQLException {
      final PGNotification[] notifications =
          pgConnection.getNotifications(Math.toIntExact(Math.max(1L, timeout.toMillis())));
      if (notifications == null || notifications.length == 0) {
        return List.of();
      }
      final List<String> payloads = new ArrayList<>(notifications.length);
      for (PGNotification notification : notifications) {
        payloads.add(notification.getParameter());
      }
      return payloads;
    }

    @Override
    public void close() {
      closeQuietly(connection);
    }
  }
}
