package com.crosspost.platform.publication.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchQueueNotifier {

    private final RabbitTemplate rabbitTemplate;

    @Value("${publication.dispatch.queue:publication.scheduled}")
    private String dispatchQueue;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPublicationScheduled(PublicationScheduledEvent event) {
        try {
            rabbitTemplate.convertAndSend(dispatchQueue, event.getPublicationId().toString());
            log.info("Queued publication {} for dispatch at {}", event.getPublicationId(), event.getScheduledAt());
        } catch (AmqpException e) {
            // posts stay PENDING in the database, the worker picks them up on its next poll
            log.error("Failed to queue publication {} for dispatch: {}",
                    event.getPublicationId(), e.getMessage(), e);
        }
    }
}
