/*
 * どこで: MessageQueue 監視ワーカー
 * 何を: スケジュールで backlog 監視を起動する
 * なぜ: stale lease の滞留を一定間隔で検出するため
 */
package com.example.messagequeue.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "messagequeue.monitor.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MessageQueueMonitorWorker {

  private final MessageQueueMonitorService monitorService;

  @Scheduled(fixedDelayString = "${messagequeue.monitor.poll-interval}")
  public void run() {
    monitorService.refresh();
  }
}
