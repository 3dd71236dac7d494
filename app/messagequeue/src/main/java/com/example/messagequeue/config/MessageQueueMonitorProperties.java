/*
 * どこで: MessageQueue の設定バインド
 * 何を: backlog 監視の有効化/間隔/対象キューを保持する
 * なぜ: 監視対象を環境ごとに切り替えるため
 */
package com.example.messagequeue.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "messagequeue.monitor")
@Validated
public record MessageQueueMonitorProperties(
    boolean enabled, @NotNull Duration pollInterval, List<String> queues) {

  public MessageQueueMonitorProperties {
    // 未設定は監視対象なしとして扱う
    queues = queues == null ? List.of() : List.copyOf(queues);
  }

  @AssertTrue(message = "messagequeue.monitor.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return pollInterval == null || (!pollInterval.isZero() && !pollInterval.isNegative());
  }
}
