/*
 * どこで: MessageQueue サービス層
 * 何を: スコープ読み出しで実行する処理の抽象化インターフェース
 * なぜ: 正常終了なら ack、例外なら nack と結果を結び付けるため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.model.QueueMessage;

@FunctionalInterface
public interface MessageHandler<R> {
    R handle(QueueMessage message);
}
