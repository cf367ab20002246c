/*
 * どこで: Milestone サービス層
 * 何を: 予約、配信、リスナーの結果を Micrometer のメーターに記録する
 * なぜ: ログを読まずに両配信経路とリスナーの状態を観測できるようにするため
 */
package com.example.milestone.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  public static final String PATH_BATCH = "batch";
  public static final String PATH_REALTIME = "realtime";

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_SCHEDULED_TOTAL = "notification.scheduled.total";
  private static final String METRIC_LISTENER_RECONNECTS = "notification.listener.reconnects.total";
  private static final String METRIC_LISTENER_MALFORMED = "notification.listener.malformed.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter scheduledCounter;
  private final Counter reconnectCounter;
  private final Counter malformedCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.scheduledCounter =
        Counter.builder(METRIC_SCHEDULED_TOTAL)
            .description("Notifications persisted as scheduled by the pipeline")
            .register(meterRegistry);
    this.reconnectCounter =
        Counter.builder(METRIC_LISTENER_RECONNECTS)
            .description("Reconnect attempts of the milestone listener")
            .register(meterRegistry);
    this.malformedCounter =
        Counter.builder(METRIC_LISTENER_MALFORMED)
            .description("Milestone payloads that could not be parsed")
            .register(meterRegistry);
  }

  public void recordDelivery(String path, int sent, int failed) {
    deliveryCounter(path, "sent").increment(sent);
    deliveryCounter(path, "failed").increment(failed);
  }

  public void recordScheduled(int count) {
    scheduledCounter.increment(count);
  }

  public void recordListenerReconnect() {
    reconnectCounter.increment();
  }

  public void recordMalformedPayload() {
    malformedCounter.increment();
  }

  private Counter deliveryCounter(String path, String result) {
    return deliveryCounters.computeIfAbsent(
        path + ":" + result,
        ignored ->
            Counter.builder(METRIC_DELIVERY_TOTAL)
                .description("Push delivery outcomes")
                .tags(Tags.of("path", path, "result", result))
                .register(meterRegistry));
  }
}
