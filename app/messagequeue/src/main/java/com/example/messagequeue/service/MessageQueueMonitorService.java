/*
 * どこで: MessageQueue サービス層
 * 何を: 監視対象キューの backlog ゲージを更新する
 * なぜ: 停止したコンシューマの期限切れリースで滞留したメッセージを検知するため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.config.MessageQueueMonitorProperties;
import com.example.messagequeue.model.QueueStats;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageQueueMonitorService {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueueMonitorService.class);

  private final MessageQueueFactory queueFactory;
  private final MessageQueueMonitorProperties properties;
  private final MessageQueueMetrics metrics;

  public void refresh() {
    for (String queueName : properties.queues()) {
      final QueueStats stats = queueFactory.queue(queueName).stats();
      metrics.updateBacklog(queueName, stats.available(), stats.stale());
      if (stats.stale() > 0) {
        logger.warn(
            "message queue has stale leases queue={} stale={} available={} leased={}",
            queueName,
            stats.stale(),
            stats.available(),
            stats.leased());
      }
    }
  }
}
