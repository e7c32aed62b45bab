package com.cred.freestyle.warranty.infrastructure.messaging;

import com.cred.freestyle.warranty.infrastructure.messaging.events.SerialLedgerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for publishing serial ledger events.
 *
 * Events are published only after the ledger change has committed and are
 * best-effort: a serialization or send failure is logged and never
 * propagated to the caller.
 *
 * Topic partitioning strategy:
 * - Key: serial number (or product ID for imports), so all events for one
 *   serial stay ordered on one partition
 *
 * @author Warranty Platform Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String serialEventsTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${warranty.kafka.serial-events-topic:warranty-serial-events}") String serialEventsTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.serialEventsTopic = serialEventsTopic;
    }

    /**
     * Publish a ledger event.
     *
     * @param event Serial ledger event
     */
    public void publishLedgerEvent(SerialLedgerEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    serialEventsTopic,
                    event.partitionKey(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} event {} (key: {}), partition: {}",
                            event.getEventType(), event.getEventId(), event.partitionKey(),
                            result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event {} (key: {})",
                            event.getEventType(), event.getEventId(), event.partitionKey(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing ledger event {}", event.getEventId(), e);
        } catch (RuntimeException e) {
            logger.error("Error sending ledger event {} to topic {}", event.getEventId(), serialEventsTopic, e);
        }
    }
}
