package com.cred.freestyle.lottery.infrastructure.messaging;

import com.cred.freestyle.lottery.infrastructure.messaging.events.LotteryImportCommittedEvent;
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
 * Kafka producer for back office events.
 * Publishing is fire and forget: failures are logged and never reach the caller.
 *
 * Topic partitioning strategy:
 * - Key: state_id (all imports of a state land on the same partition, in commit order)
 *
 * @author Lottery Back Office Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String importEventsTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${lottery.kafka.import-events-topic:lottery-import-events}") String importEventsTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.importEventsTopic = importEventsTopic;
    }

    /**
     * Publish import committed event.
     *
     * @param event Import committed event
     */
    public void publishImportCommitted(LotteryImportCommittedEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    importEventsTopic,
                    event.getStateId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published import committed event for import {}, state: {}, partition: {}",
                            event.getImportId(), event.getStateId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish import committed event for import {}", event.getImportId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing import committed event for import {}", event.getImportId(), e);
        } catch (Exception e) {
            logger.error("Error sending import committed event for import {}", event.getImportId(), e);
        }
    }
}
