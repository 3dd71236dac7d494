/*
 * どこで: MessageQueue ドメインモデル
 * 何を: message_queue テーブル 1 行のスナップショット
 * なぜ: リース状態の確認と運用調査で共通化するため
 */
package com.example.messagequeue.model;

import java.time.Instant;

public record MessageRecord(
        long id,
        String queueName,
        String payload,
        Instant createdAt,
        Instant leasedAt,
        Instant leaseExpiresAt,
        int leaseSeconds,
        boolean locked) {
}
