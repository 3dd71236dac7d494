/*
 * どこで: MessageQueue サービス層
 * 何を: キュー操作件数/処理時間/backlog のメトリクスを記録する
 * なぜ: 再配信の多発や stale lease の滞留を Prometheus から観測できるようにするため
 */
package com.example.messagequeue.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MessageQueueMetrics {

  static final String METRIC_OPERATIONS_TOTAL = "messagequeue.operations.total";
  static final String METRIC_PROCESSING_DURATION = "messagequeue.processing.duration";
  static final String METRIC_BACKLOG_AVAILABLE = "messagequeue.backlog.available";
  static final String METRIC_BACKLOG_STALE = "messagequeue.backlog.stale";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> operationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> processingTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> availableGauges = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> staleGauges = new ConcurrentHashMap<>();

  public MessageQueueMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordOperation(String queueName, String operation) {
    operationCounters
        .computeIfAbsent(
            queueName + '\n' + operation,
            ignored ->
                Counter.builder(METRIC_OPERATIONS_TOTAL)
                    .description("Message queue operations by outcome")
                    .tags(Tags.of("queue", queueName, "operation", operation))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProcessing(String queueName, String outcome, Duration elapsed) {
    if (elapsed == null || elapsed.isNegative()) {
      return;
    }
    processingTimers
        .computeIfAbsent(
            queueName + '\n' + outcome,
            ignored ->
                Timer.builder(METRIC_PROCESSING_DURATION)
                    .description("Time spent in scoped-read handlers")
                    .tags(Tags.of("queue", queueName, "outcome", outcome))
                    .register(meterRegistry))
        .record(elapsed);
  }

  public void updateBacklog(String queueName, long available, long stale) {
    backlogGauge(availableGauges, METRIC_BACKLOG_AVAILABLE, "Messages eligible for lease", queueName)
        .set(Math.max(available, 0));
    backlogGauge(staleGauges, METRIC_BACKLOG_STALE, "Messages whose lease expired without ack", queueName)
        .set(Math.max(stale, 0));
  }

  private AtomicLong backlogGauge(
      ConcurrentMap<String, AtomicLong> gauges, String name, String description, String queueName) {
    return gauges.computeIfAbsent(
        queueName,
        ignored -> {
          final AtomicLong value = new AtomicLong(0);
          Gauge.builder(name, value, AtomicLong::get)
              .description(description)
              .tags(Tags.of("queue", queueName))
              .register(meterRegistry);
          return value;
        });
  }
}
