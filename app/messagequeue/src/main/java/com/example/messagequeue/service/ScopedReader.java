/*
 * どこで: MessageQueue サービス層
 * 何を: ハンドラの成否に応じて ack/nack するスコープ読み出しを提供する
 * なぜ: 呼び出し側が ack 忘れや失敗時の放置をしないようにするため
 */
package com.example.messagequeue.service;

import com.example.common.TraceIds;
import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.model.QueueMessage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Ties acknowledgment to the outcome of caller code. A handler that returns acks its message; a
 * handler that throws releases the lease at once (a zero-second lease change) and the original
 * throwable propagates unchanged.
 */
public class ScopedReader {

  private static final Logger logger = LoggerFactory.getLogger(ScopedReader.class);

  static final String MDC_TRACE_ID = "trace_id";
  static final String MDC_QUEUE_NAME = "queue_name";
  static final String MDC_MESSAGE_ID = "message_id";

  private final MessageQueue queue;
  private final MessageQueueMetrics metrics;
  private final Clock clock;

  ScopedReader(MessageQueue queue, MessageQueueMetrics metrics, Clock clock) {
    this.queue = queue;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Receives one message and runs {@code handler} on it.
   *
   * @throws EmptyQueueException when the queue is empty; the handler is not called
   */
  public <R> R withMessage(MessageHandler<R> handler) {
    return process(queue.receive(), handler);
  }

  /**
   * Like {@link #withMessage(MessageHandler)}, but an empty queue calls the handler with {@link
   * QueueMessage#fallback(String)} instead of throwing.
   */
  public <R> R withMessage(String defaultPayload, MessageHandler<R> handler) {
    final LeasedMessage leased;
    try {
      leased = queue.receive();
    } catch (EmptyQueueException ex) {
      return handler.handle(QueueMessage.fallback(defaultPayload));
    }
    return process(leased, handler);
  }

  /**
   * Processes messages until the queue is observed empty. A handler failure releases that
   * message and stops the loop by propagating.
   *
   * @return number of messages acknowledged
   */
  public int drain(MessageHandler<?> handler) {
    int processed = 0;
    while (true) {
      final LeasedMessage leased;
      try {
        leased = queue.receive();
      } catch (EmptyQueueException ex) {
        return processed;
      }
      process(leased, handler);
      processed++;
    }
  }

  /**
   * Opens a lazy cursor over the queue. Use it in try-with-resources so that a message whose
   * loop body threw is released on close.
   */
  public DrainCursor drain() {
    return new DrainCursor(queue);
  }

  private <R> R process(LeasedMessage leased, MessageHandler<R> handler) {
    final Instant startedAt = Instant.now(clock);
    final R result;
    final String previousTraceId = MDC.get(MDC_TRACE_ID);
    final String previousQueueName = MDC.get(MDC_QUEUE_NAME);
    final String previousMessageId = MDC.get(MDC_MESSAGE_ID);
    MDC.put(MDC_TRACE_ID, TraceIds.deliveryTraceId(queue.name(), leased.id()));
    MDC.put(MDC_QUEUE_NAME, queue.name());
    MDC.put(MDC_MESSAGE_ID, Long.toString(leased.id()));
    try {
      result = handler.handle(QueueMessage.of(leased));
    } catch (Throwable ex) {
      // 検査例外が送出されても必ずリースを返却する
      release(leased, ex);
      metrics.recordProcessing(queue.name(), "released", elapsedSince(startedAt));
      throw ex;
    } finally {
      restoreMdc(MDC_TRACE_ID, previousTraceId);
      restoreMdc(MDC_QUEUE_NAME, previousQueueName);
      restoreMdc(MDC_MESSAGE_ID, previousMessageId);
    }
    // ack の失敗は処理結果と切り離し、lease 満了後の再配信に任せる
    queue.ack(leased.id());
    metrics.recordProcessing(queue.name(), "acked", elapsedSince(startedAt));
    return result;
  }

  private static void restoreMdc(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }

  private void release(LeasedMessage leased, Throwable failure) {
    logger.warn("message handler failed; releasing lease queue={} id={}", queue.name(), leased.id());
    try {
      queue.nack(leased.id());
    } catch (RuntimeException ex) {
      failure.addSuppressed(ex);
      logger.warn("failed to nack message queue={} id={}", queue.name(), leased.id(), ex);
    }
  }

  private Duration elapsedSince(Instant startedAt) {
    return Duration.between(startedAt, Instant.now(clock));
  }
}
