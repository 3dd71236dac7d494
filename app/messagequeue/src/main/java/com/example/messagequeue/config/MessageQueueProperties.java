/*
 * どこで: MessageQueue の設定バインド
 * 何を: 既定リース時間/テーブル名/起動時スキーマ操作を保持する
 * なぜ: SQL に埋め込むテーブル名とリース上限を起動時に検証するため
 */
package com.example.messagequeue.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "messagequeue")
@Validated
public record MessageQueueProperties(
    @NotNull Duration defaultLease,
    @NotBlank @Pattern(regexp = "^[a-zA-Z0-9_]+$") String tableName,
    @NotNull @Valid Schema schema) {

  /** Upper bound of a lease, stored in an INTEGER column. */
  public static final long MAX_LEASE_SECONDS = Integer.MAX_VALUE;

  @AssertTrue(message = "messagequeue.default-lease must be between 0 and 2147483647 seconds")
  public boolean isDefaultLeaseInRange() {
    // null は @NotNull で検出する前提。
    return defaultLease == null
        || (!defaultLease.isNegative() && defaultLease.toSeconds() <= MAX_LEASE_SECONDS);
  }

  /**
   * Schema actions applied once while the application context starts.
   *
   * @param createOnStartup create the table and index when missing
   * @param dropOnStartup drop the table first, discarding every queued message
   */
  public record Schema(boolean createOnStartup, boolean dropOnStartup) {}
}
