package com.flagship.marketplace.messaging;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.identity.Actor;
import com.flagship.marketplace.notification.NotificationEvent;
import com.flagship.marketplace.notification.NotificationType;
import com.flagship.marketplace.outbox.OutboxService;
import com.flagship.marketplace.transaction.Party;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only conversation attached to each transaction.
 *
 * Buyer and seller may post while the transaction is open. System messages
 * are written by the state machine as part of each transition and are
 * accepted in any state, including after the transaction has ended.
 */
@Service
@Slf4j
public class MessagingLedger {

    public static final UUID SYSTEM_SENDER_ID = Actor.system().getId();

    private final MessageRepository repository;
    private final TransactionStore transactionStore;
    private final OutboxService outboxService;
    private final Clock clock;
    private final int pageSize;
    private final int maxLength;

    public MessagingLedger(MessageRepository repository,
                           TransactionStore transactionStore,
                           OutboxService outboxService,
                           Clock clock,
                           @Value("${marketplace.messages.page-size:50}") int pageSize,
                           @Value("${marketplace.messages.max-length:2000}") int maxLength) {
        this.repository = repository;
        this.transactionStore = transactionStore;
        this.outboxService = outboxService;
        this.clock = clock;
        this.pageSize = pageSize;
        this.maxLength = maxLength;
    }

    @Transactional
    public Message postMessage(UUID transactionId, Actor actor, String text) {
        Transaction transaction = transactionStore.get(transactionId);
        Party party = transaction.partyOf(actor.getId())
                .orElseThrow(() -> MarketplaceException.notAuthorized(
                        String.format("User %s is not a party to transaction %s", actor.getId(), transactionId)));

        if (text == null || text.isBlank()) {
            throw MarketplaceException.validation("Message text is required");
        }
        String trimmed = text.strip();
        if (trimmed.length() > maxLength) {
            throw MarketplaceException.validation(
                    String.format("Message exceeds %d characters", maxLength));
        }
        if (transaction.isTerminal()) {
            throw MarketplaceException.invalidState(
                    String.format("Cannot post to transaction %s: transaction is already %s",
                            transactionId, transaction.getStatus()));
        }

        Instant now = Instant.now(clock);
        SenderType senderType = party == Party.BUYER ? SenderType.BUYER : SenderType.SELLER;
        Message message = save(Message.create(transactionId, actor.getId(), senderType, trimmed, now));

        outboxService.saveNotification(NotificationEvent.create(
                NotificationType.MESSAGE_POSTED,
                NotificationEvent.TRANSACTION,
                transactionId,
                transaction.counterpartyOf(party),
                Map.of("messageId", message.getId().toString(), "senderType", senderType.name()),
                now));

        log.info("Message posted: transactionId={}, sender={}", transactionId, senderType);
        return message;
    }

    /**
     * Records a state change annotation. Joins the transition's unit of work.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Message appendSystemMessage(UUID transactionId, String text, Instant now) {
        Message message = save(Message.create(transactionId, SYSTEM_SENDER_ID, SenderType.SYSTEM, text, now));
        log.debug("System message appended: transactionId={}, text={}", transactionId, text);
        return message;
    }

    /**
     * Returns a lazy history for the buyer, the seller or an administrator.
     * Access is checked now; messages are read when the history is iterated.
     */
    @Transactional(readOnly = true)
    public MessageHistory listMessages(UUID transactionId, Actor actor) {
        Transaction transaction = transactionStore.get(transactionId);
        if (!actor.isAdministrator() && transaction.partyOf(actor.getId()).isEmpty()) {
            throw MarketplaceException.notAuthorized(
                    String.format("User %s cannot read messages of transaction %s", actor.getId(), transactionId));
        }
        return new MessageHistory(repository, transactionId, pageSize);
    }

    /**
     * Marks every message not sent by the reader as read.
     *
     * @return number of messages newly marked
     */
    @Transactional
    public int markRead(UUID transactionId, Actor actor) {
        Transaction transaction = transactionStore.get(transactionId);
        if (transaction.partyOf(actor.getId()).isEmpty()) {
            throw MarketplaceException.notAuthorized(
                    String.format("User %s is not a party to transaction %s", actor.getId(), transactionId));
        }
        int updated = repository.markReadFor(transactionId, actor.getId(), Instant.now(clock));
        log.debug("Marked {} messages read: transactionId={}, reader={}", updated, transactionId, actor.getId());
        return updated;
    }

    private Message save(Message message) {
        return repository.saveAndFlush(MessageEntity.fromDomain(message)).toDomain();
    }
}
