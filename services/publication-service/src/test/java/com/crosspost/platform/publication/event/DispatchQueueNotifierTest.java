package com.crosspost.platform.publication.event;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.net.ConnectException;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.test.util.ReflectionTestUtils;

class DispatchQueueNotifierTest {

    private RabbitTemplate rabbitTemplate;
    private DispatchQueueNotifier notifier;

    @BeforeEach
    void setUp() {
        rabbitTemplate = mock(RabbitTemplate.class);
        notifier = new DispatchQueueNotifier(rabbitTemplate);
        ReflectionTestUtils.setField(notifier, "dispatchQueue", "publication.scheduled");
    }

    @Test
    void scheduled_publication_id_is_queued() {
        UUID publicationId = UUID.randomUUID();

        notifier.onPublicationScheduled(new PublicationScheduledEvent(
                publicationId, UUID.randomUUID(), OffsetDateTime.now().plusHours(1)));

        verify(rabbitTemplate).convertAndSend("publication.scheduled", publicationId.toString());
    }

    @Test
    void broker_outage_does_not_escape_the_listener() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), any(Object.class));

        assertDoesNotThrow(() -> notifier.onPublicationScheduled(new PublicationScheduledEvent(
                UUID.randomUUID(), UUID.randomUUID(), OffsetDateTime.now())));
    }
}
