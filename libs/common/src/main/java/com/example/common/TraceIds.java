/*
 * どこで: 共通ユーティリティ
 * 何を: ログ相関用のトレース ID を採番する
 * なぜ: 同じメッセージの再配信をログ上で区別するため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // message_id は再配信でも変わらないため、配信ごとの乱数部を付ける
  public static String deliveryTraceId(String queueName, long messageId) {
    return queueName + ":" + messageId + ":" + newTraceId().substring(0, 8);
  }
}
