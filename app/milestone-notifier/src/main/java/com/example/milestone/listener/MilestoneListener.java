/*
 * どこで: Milestone リアルタイムリスナー
 * 何を: マイルストーンチャネルの LISTEN 購読を保持し、バックオフ付きで再接続する
 * なぜ: マイルストーンイベントはライブでのみ発行され、購読が切れている間の分は再送されないため
 */
package com.example.milestone.listener;

import com.example.common.event.MilestoneEvent;
import com.example.milestone.config.MilestoneListenerProperties;
import com.example.milestone.model.EntityType;
import com.example.milestone.service.NotificationMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.listener.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MilestoneListener implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(MilestoneListener.class);
  private static final String THREAD_NAME = "milestone-listener";

  private final ListenSessionFactory sessionFactory;
  private final MilestoneEventHandler eventHandler;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The handler executor is a shared Spring-managed pool")
  private final Executor handlerExecutor;

  private final ObjectMapper objectMapper;
  private final MilestoneListenerProperties properties;
  private final NotificationMetrics metrics;
  private final AtomicReference<ListenerState> state;
  private final AtomicBoolean running;
  private volatile CountDownLatch shutdownSignal;
  private volatile Thread thread;

  public MilestoneListener(
      ListenSessionFactory sessionFactory,
      MilestoneEventHandler eventHandler,
      @Qualifier("milestoneHandlerExecutor") Executor handlerExecutor,
      ObjectMapper objectMapper,
      MilestoneListenerProperties properties,
      NotificationMetrics metrics) {
    this.sessionFactory = sessionFactory;
    this.eventHandler = eventHandler;
    this.handlerExecutor = handlerExecutor;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.state = new AtomicReference<>(ListenerState.DISCONNECTED);
    this.running = new AtomicBoolean(false);
    this.shutdownSignal = new CountDownLatch(1);
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    shutdownSignal = new CountDownLatch(1);
    final Thread listenerThread = new Thread(this::runLoop, THREAD_NAME);
    listenerThread.setDaemon(true);
    thread = listenerThread;
    listenerThread.start();
    logger.info("milestone listener started channel={}", properties.channel());
  }

  /** 停止を要求し、ループを抜けるまで短時間待つ。実行中のハンドラはそのまま走らせる。 */
  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    shutdownSignal.countDown();
    final Thread listenerThread = thread;
    if (listenerThread == null) {
      return;
    }
    try {
      listenerThread.join(properties.pollTimeout().multipliedBy(2).plusSeconds(1).toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  public ListenerState state() {
    return state.get();
  }

  @VisibleForTesting
  void runLoop() {
    Duration backoff = properties.initialBackoff();
    while (true) {
      final SessionOutcome outcome = runSession();
      state.set(ListenerState.DISCONNECTED);
      // 停止要求をエラーより先に見て、停止後に再接続しないようにする
      if (isShutdownRequested()) {
        logger.info("milestone listener stopped");
        return;
      }
      if (outcome.reachedListening()) {
        backoff = properties.initialBackoff();
      }
      logger.error(
          "milestone listener disconnected, reconnecting backoff={}", backoff, outcome.error());
      metrics.recordListenerReconnect();
      if (awaitShutdown(backoff)) {
        logger.info("milestone listener stopped");
        return;
      }
      backoff = nextBackoff(backoff, properties.maxBackoff());
    }
  }

  private SessionOutcome runSession() {
    state.set(ListenerState.CONNECTING);
    boolean reachedListening = false;
    try (ListenSession session = sessionFactory.open(properties.channel())) {
      state.set(ListenerState.LISTENING);
      reachedListening = true;
      logger.info("milestone listener connected channel={}", properties.channel());
      while (!isShutdownRequested()) {
        for (String payload : session.awaitPayloads(properties.pollTimeout())) {
          dispatch(payload);
        }
      }
      return new SessionOutcome(true, null);
    } catch (SQLException | DataAccessException ex) {
      return new SessionOutcome(reachedListening, ex);
    } catch (RuntimeException ex) {
      logger.error("milestone listener session crashed", ex);
      return new SessionOutcome(reachedListening, ex);
    }
  }

  @VisibleForTesting
  void dispatch(String payload) {
    final Optional<MilestoneEvent> parsed = parse(payload);
    if (parsed.isEmpty()) {
      metrics.recordMalformedPayload();
      return;
    }
    final MilestoneEvent event = parsed.get();
    logger.info(
        "milestone event received entityType={} entityId={} sport={} stat={} percentile={}",
        event.entityType(),
        event.entityId(),
        event.sport(),
        event.statKey(),
        event.percentile());
    handlerExecutor.execute(() -> handleSafely(event));
  }

  private Optional<MilestoneEvent> parse(String payload) {
    try {
      final MilestoneEvent event = objectMapper.readValue(payload, MilestoneEvent.class);
      EntityType.fromDbValue(event.entityType());
      return Optional.of(event);
    } catch (JsonProcessingException ex) {
      logger.warn("failed to parse milestone event payload={}", payload, ex);
      return Optional.empty();
    } catch (IllegalArgumentException ex) {
      logger.warn("unsupported milestone event payload={} reason={}", payload, ex.getMessage());
      return Optional.empty();
    }
  }

  private void handleSafely(MilestoneEvent event) {
    try {
      eventHandler.handle(event);
    } catch (RuntimeException ex) {
      logger.error(
          "milestone handler failed entityType={} entityId={}",
          event.entityType(),
          event.entityId(),
          ex);
    }
  }

  private boolean isShutdownRequested() {
    return shutdownSignal.getCount() == 0;
  }

  private boolean awaitShutdown(Duration timeout) {
    try {
      return shutdownSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  @VisibleForTesting
  static Duration nextBackoff(Duration current, Duration max) {
    final Duration doubled = current.multipliedBy(2);
    return doubled.compareTo(max) > 0 ? max : doubled;
  }

  private record SessionOutcome(boolean reachedListening, Exception error) {}
}
