/*
 * どこで: DrainCursor のユニットテスト
 * 何を: 遅延取得・次要素取得時の ack・close 時の nack を検証する
 * なぜ: for 文の途中で例外や break があってもメッセージを取りこぼさないため
 */
package com.example.messagequeue.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.model.QueueMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DrainCursorTest {

    private static final String QUEUE = "orders";

    @Mock
    private MessageQueue queue;

    @BeforeEach
    void setUp() {
        lenient().when(queue.name()).thenReturn(QUEUE);
    }

    @Test
    void cursorIsLazyUntilFirstHasNext() {
        new DrainCursor(queue);

        verifyNoInteractions(queue);
    }

    @Test
    void loopAcksEachMessageBeforeLeasingTheNext() {
        when(queue.receive())
                .thenReturn(new LeasedMessage(1L, "a"), new LeasedMessage(2L, "b"))
                .thenThrow(new EmptyQueueException(QUEUE));
        List<String> seen = new ArrayList<>();

        try (DrainCursor cursor = new DrainCursor(queue)) {
            for (QueueMessage message : cursor) {
                seen.add(message.payload());
            }
        }

        assertThat(seen).containsExactly("a", "b");
        InOrder order = inOrder(queue);
        order.verify(queue).receive();
        order.verify(queue).ack(1L);
        order.verify(queue).receive();
        order.verify(queue).ack(2L);
        order.verify(queue).receive();
        verify(queue, never()).nack(anyLong());
    }

    @Test
    void failureInLoopBodyReleasesCurrentMessageOnClose() {
        when(queue.receive()).thenReturn(new LeasedMessage(1L, "a"), new LeasedMessage(2L, "b"));

        assertThatThrownBy(() -> {
            try (DrainCursor cursor = new DrainCursor(queue)) {
                for (QueueMessage message : cursor) {
                    if ("b".equals(message.payload())) {
                        throw new IllegalStateException("boom");
                    }
                }
            }
        }).isInstanceOf(IllegalStateException.class);

        verify(queue).ack(1L);
        verify(queue).nack(2L);
        verify(queue, never()).ack(2L);
    }

    @Test
    void breakingOutReleasesCurrentMessage() {
        when(queue.receive()).thenReturn(new LeasedMessage(1L, "a"));

        try (DrainCursor cursor = new DrainCursor(queue)) {
            assertThat(cursor.next().id()).isEqualTo(1L);
        }

        verify(queue).nack(1L);
        verify(queue, never()).ack(anyLong());
    }

    @Test
    void prefetchedButUnreturnedMessageIsReleasedOnClose() {
        when(queue.receive()).thenReturn(new LeasedMessage(1L, "a"));

        DrainCursor cursor = new DrainCursor(queue);
        assertThat(cursor.hasNext()).isTrue();
        cursor.close();
        cursor.close();

        verify(queue).nack(1L);
        assertThat(cursor.hasNext()).isFalse();
    }

    @Test
    void exhaustedCursorIsNotRestartable() {
        when(queue.receive()).thenThrow(new EmptyQueueException(QUEUE));

        DrainCursor cursor = new DrainCursor(queue);

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.hasNext()).isFalse();
        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
        verify(queue).receive();
    }
}
