/*
 * どこで: MessageQueue ドメインモデル
 * 何を: キュー単位の件数集計
 * なぜ: backlog と stale lease を監視するため
 */
package com.example.messagequeue.model;

/**
 * Message counts of one queue, evaluated against the store clock.
 *
 * @param available unlocked messages plus messages whose lease has expired
 * @param leased messages under an unexpired lease
 * @param stale locked messages whose lease has expired (a subset of {@code available})
 */
public record QueueStats(String queueName, long available, long leased, long stale) {

  public long total() {
    return available + leased;
  }
}
