/*
 * どこで: MessageQueue サービス層
 * 何を: 1 つのキュー名に束縛した送信/受信/ack/nack と管理操作を提供する
 * なぜ: 呼び出し側がキュー名とリース既定値を毎回渡さずに済むようにするため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.model.MessageRecord;
import com.example.messagequeue.model.QueueStats;
import com.example.messagequeue.repository.MessageRepository;
import com.example.messagequeue.repository.MessageSchemaRepository;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle bound to one named queue. Instances are obtained from {@link MessageQueueFactory}, hold
 * no mutable state and may be shared across threads.
 *
 * <p>Delivery is at-least-once: a message is removed only by {@link #ack}, and a lease that
 * expires before the ack makes the message visible to other consumers again.
 */
public class MessageQueue {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueue.class);

  private final String name;
  private final Duration defaultLease;
  private final LeaseManager leaseManager;
  private final MessageRepository messageRepository;
  private final MessageSchemaRepository schemaRepository;
  private final MessageQueueMetrics metrics;
  private final Clock clock;

  MessageQueue(
      String name,
      Duration defaultLease,
      LeaseManager leaseManager,
      MessageRepository messageRepository,
      MessageSchemaRepository schemaRepository,
      MessageQueueMetrics metrics,
      Clock clock) {
    this.name = name;
    this.defaultLease = defaultLease;
    this.leaseManager = leaseManager;
    this.messageRepository = messageRepository;
    this.schemaRepository = schemaRepository;
    this.metrics = metrics;
    this.clock = clock;
  }

  public String name() {
    return name;
  }

  public Duration defaultLease() {
    return defaultLease;
  }

  public long send(String payload) {
    return send(payload, defaultLease);
  }

  /**
   * @param lease lease duration applied every time this message is received; must be longer
   *     than the time a consumer needs to process and ack it, or the message may be processed
   *     twice
   */
  public long send(String payload, Duration lease) {
    final long id = leaseManager.send(name, payload, lease);
    metrics.recordOperation(name, "sent");
    return id;
  }

  /**
   * Leases the oldest available message. The caller must {@link #ack} it after processing or
   * {@link #nack} it to hand it back.
   *
   * @throws EmptyQueueException when nothing is available
   */
  public LeasedMessage receive() {
    try {
      final LeasedMessage leased = leaseManager.lease(name);
      metrics.recordOperation(name, "leased");
      return leased;
    } catch (EmptyQueueException ex) {
      metrics.recordOperation(name, "empty");
      throw ex;
    }
  }

  public void ack(long id) {
    leaseManager.ack(id);
    metrics.recordOperation(name, "acked");
  }

  /** Releases the lease so that any consumer can receive the message right away. */
  public void nack(long id) {
    leaseManager.changeLease(id, Duration.ZERO);
    metrics.recordOperation(name, "released");
  }

  public void changeLease(long id, Duration lease) {
    leaseManager.changeLease(id, lease);
    metrics.recordOperation(name, "lease_changed");
  }

  public ScopedReader reader() {
    return new ScopedReader(this, metrics, clock);
  }

  public QueueStats stats() {
    return messageRepository.countStats(name);
  }

  public List<MessageRecord> snapshot() {
    return messageRepository.findByQueueName(name);
  }

  /** Deletes every message of this queue, leased or not. */
  public int purge() {
    final int deleted = messageRepository.deleteByQueueName(name);
    logger.info("message queue purged queue={} deleted={}", name, deleted);
    return deleted;
  }

  // 以下の管理操作はキュー名に関係なく共有テーブル全体に作用する
  public void create() {
    schemaRepository.create();
  }

  public void drop() {
    schemaRepository.drop();
  }

  public void reset() {
    schemaRepository.drop();
    schemaRepository.create();
  }
}
