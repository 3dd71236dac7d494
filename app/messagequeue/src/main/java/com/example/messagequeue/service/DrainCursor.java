/*
 * どこで: MessageQueue サービス層
 * 何を: キューが空になるまでメッセージを遅延取得するカーソル
 * なぜ: for 文で逐次処理しつつ、ループ本体の成否で ack/nack を決めるため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.model.QueueMessage;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-use iterator that leases one message at a time.
 *
 * <p>Returning to {@link #hasNext()} acknowledges the message handed out by the previous {@link
 * #next()}. {@link #close()} releases any message still outstanding, which covers a loop body that
 * threw and a caller that broke out early. The cursor ends, without throwing, the first time the
 * queue is observed empty, and it cannot be restarted.
 *
 * <pre>{@code
 * try (DrainCursor cursor = queue.reader().drain()) {
 *   for (QueueMessage message : cursor) {
 *     process(message.payload());
 *   }
 * }
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public class DrainCursor implements Iterator<QueueMessage>, Iterable<QueueMessage>, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(DrainCursor.class);

  private final MessageQueue queue;
  private LeasedMessage outstanding;
  private LeasedMessage prefetched;
  private boolean exhausted;
  private boolean closed;

  DrainCursor(MessageQueue queue) {
    this.queue = queue;
  }

  @Override
  public boolean hasNext() {
    if (prefetched != null) {
      return true;
    }
    if (exhausted || closed) {
      return false;
    }
    ackOutstanding();
    try {
      prefetched = queue.receive();
      return true;
    } catch (EmptyQueueException ex) {
      exhausted = true;
      return false;
    }
  }

  @Override
  public QueueMessage next() {
    if (!hasNext()) {
      throw new NoSuchElementException("queue " + queue.name() + " drained");
    }
    outstanding = prefetched;
    prefetched = null;
    return QueueMessage.of(outstanding);
  }

  @Override
  public Iterator<QueueMessage> iterator() {
    return this;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    final LeasedMessage current = outstanding;
    final LeasedMessage pending = prefetched;
    outstanding = null;
    prefetched = null;
    try {
      release(current);
    } finally {
      release(pending);
    }
  }

  private void ackOutstanding() {
    if (outstanding == null) {
      return;
    }
    final long id = outstanding.id();
    outstanding = null;
    queue.ack(id);
  }

  private void release(LeasedMessage leased) {
    if (leased == null) {
      return;
    }
    logger.debug("drain cursor closed with outstanding message; releasing queue={} id={}",
        queue.name(), leased.id());
    queue.nack(leased.id());
  }
}
