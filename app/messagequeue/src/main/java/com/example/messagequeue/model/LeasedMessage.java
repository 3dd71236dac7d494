/*
 * どこで: MessageQueue ドメインモデル
 * 何を: リースを獲得したメッセージの ID とペイロード
 * なぜ: ID を ack/nack のハンドルとして呼び出し側へ渡すため
 */
package com.example.messagequeue.model;

public record LeasedMessage(long id, String payload) {
}
