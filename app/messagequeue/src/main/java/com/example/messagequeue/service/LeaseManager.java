/*
 * どこで: MessageQueue サービス層
 * 何を: メッセージの送信/リース獲得/延長/削除をトランザクション単位で行う
 * なぜ: 競合するコンシューマ間の排他を DB の行ロックだけで実現するため
 */
package com.example.messagequeue.service;

import com.example.messagequeue.config.MessageQueueProperties;
import com.example.messagequeue.model.LeasedMessage;
import com.example.messagequeue.repository.MessageRepository;
import com.example.messagequeue.repository.PayloadCodec;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Lease protocol over the message table.
 *
 * <p>Each public operation runs in exactly one store transaction. No in-process lock is taken; two
 * consumers racing for the same row are separated by {@code FOR UPDATE SKIP LOCKED}, and a lease
 * abandoned by a crashed consumer becomes eligible again once the store clock passes its expiry.
 */
@Service
@RequiredArgsConstructor
public class LeaseManager {

    private static final Logger logger = LoggerFactory.getLogger(LeaseManager.class);

    private final MessageRepository messageRepository;
    private final PlatformTransactionManager transactionManager;

    /**
     * Inserts an unlocked message.
     *
     * @param lease how long each future lease of this message lasts
     * @return the store-assigned id
     * @throws IllegalArgumentException when the payload has no UTF-8 form (an unpaired surrogate)
     */
    public long send(String queueName, String payload, Duration lease) {
        final int leaseSeconds = toLeaseSeconds(lease);
        PayloadCodec.encode(payload);
        final Long id = transactionTemplate()
                .execute(status -> messageRepository.insert(queueName, payload, leaseSeconds));
        if (id == null) {
            throw new IllegalStateException("message insert returned no id queue=" + queueName);
        }
        logger.debug("message sent queue={} id={} leaseSeconds={}", queueName, id, leaseSeconds);
        return id;
    }

    /**
     * Leases the oldest eligible message of the queue.
     *
     * @throws EmptyQueueException when no message is unlocked or holds an expired lease
     */
    public LeasedMessage lease(String queueName) {
        // 選択と更新を同一トランザクションに置き、他の leaser が割り込めないようにする
        final LeasedMessage leased = transactionTemplate().execute(status -> {
            final Optional<LeasedMessage> candidate = messageRepository.selectEligibleForUpdate(queueName);
            if (candidate.isEmpty()) {
                return null;
            }
            messageRepository.markLeased(candidate.get().id());
            return candidate.get();
        });
        if (leased == null) {
            throw new EmptyQueueException(queueName);
        }
        logger.debug("message leased queue={} id={}", queueName, leased.id());
        return leased;
    }

    /** Deletes the message. An id that is already gone is ignored. */
    public void ack(long id) {
        final Integer deleted = transactionTemplate().execute(status -> messageRepository.deleteById(id));
        if (deleted == null || deleted == 0) {
            logger.debug("ack ignored because message is already gone id={}", id);
        }
    }

    /**
     * Moves the lease expiry to {@code lease} from the store's current time. {@link Duration#ZERO}
     * returns the message to the pool immediately. An id that is already gone is ignored.
     */
    public void changeLease(long id, Duration lease) {
        final int leaseSeconds = toLeaseSeconds(lease);
        final Integer updated = transactionTemplate()
                .execute(status -> messageRepository.updateLeaseExpiry(id, leaseSeconds));
        if (updated == null || updated == 0) {
            logger.debug("lease change ignored because message is already gone id={}", id);
        }
    }

    static int toLeaseSeconds(Duration lease) {
        if (lease == null || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be zero or positive: " + lease);
        }
        final long seconds = lease.toSeconds();
        if (seconds > MessageQueueProperties.MAX_LEASE_SECONDS) {
            throw new IllegalArgumentException("lease exceeds " + MessageQueueProperties.MAX_LEASE_SECONDS + "s: " + lease);
        }
        return (int) seconds;
    }

    @VisibleForTesting
    TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(transactionManager);
    }
}
