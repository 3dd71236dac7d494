/*
 * どこで: MessageQueue サービス層
 * 何を: キュー名とリース既定値を束縛した MessageQueue を生成する
 * なぜ: 接続や設定をプロセス全体でキャッシュせず、DI で明示的に受け渡すため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.config.MessageQueueProperties;
import com.example.messagequeue.repository.MessageRepository;
import com.example.messagequeue.repository.MessageSchemaRepository;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageQueueFactory {

    static final int MAX_QUEUE_NAME_LENGTH = 200;

    private final LeaseManager leaseManager;
    private final MessageRepository messageRepository;
    private final MessageSchemaRepository schemaRepository;
    private final MessageQueueProperties properties;
    private final MessageQueueMetrics metrics;
    private final Clock clock;

    public MessageQueue queue(String name) {
        return queue(name, properties.defaultLease());
    }

    public MessageQueue queue(String name, Duration defaultLease) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name must not be blank");
        }
        if (name.length() > MAX_QUEUE_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "queue name longer than " + MAX_QUEUE_NAME_LENGTH + " characters: " + name);
        }
        // 送信時まで待たずに不正なリース既定値を弾く
        LeaseManager.toLeaseSeconds(defaultLease);
        return new MessageQueue(name, defaultLease, leaseManager, messageRepository, schemaRepository, metrics,
                clock);
    }

    /**
     * Opens a queue and applies schema actions first, dropping before creating when both are set.
     */
    public MessageQueue queue(String name, Duration defaultLease, boolean drop, boolean create) {
        final MessageQueue queue = queue(name, defaultLease);
        if (drop) {
            queue.drop();
        }
        if (create) {
            queue.create();
        }
        return queue;
    }
}
