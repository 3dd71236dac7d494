/*
 * どこで: MessageQueue ドメインモデル
 * 何を: スコープ読み出しのハンドラへ渡すメッセージ
 * なぜ: 空キュー時の既定値と実メッセージを区別できるようにするため
 */
package com.example.messagequeue.model;

/**
 * A message handed to a scoped-read handler.
 *
 * <p>{@code id} is {@code null} when the queue was empty and the caller's default payload was
 * substituted; such a message is never acknowledged or released.
 */
public record QueueMessage(Long id, String payload) {

  public static QueueMessage of(LeasedMessage leased) {
    return new QueueMessage(leased.id(), leased.payload());
  }

  public static QueueMessage fallback(String defaultPayload) {
    return new QueueMessage(null, defaultPayload);
  }

  public boolean isLeased() {
    return id != null;
  }
}
