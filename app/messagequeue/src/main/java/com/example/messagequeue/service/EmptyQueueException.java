/*
 * どこで: MessageQueue サービス層
 * 何を: リース可能なメッセージが無いことを示す例外
 * なぜ: ポーリング側が空キューを通常の分岐として扱えるようにするため
 */
package com.example.messagequeue.service;

public class EmptyQueueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String queueName;

    public EmptyQueueException(String queueName) {
        super("no message available in queue " + queueName);
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }
}
