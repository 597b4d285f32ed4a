package com.cred.freestyle.lottery.infrastructure.messaging;

import com.cred.freestyle.lottery.infrastructure.messaging.events.PackLifecycleEvent;
import com.cred.freestyle.lottery.infrastructure.metrics.LotteryMetricsService;
import com.cred.freestyle.lottery.service.pack.PackActivationSyncInput;
import com.cred.freestyle.lottery.service.pack.PackActivationSyncResult;
import com.cred.freestyle.lottery.service.pack.PackDeactivationSyncResult;
import com.cred.freestyle.lottery.service.pack.PackPosSyncService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Drives POS price book sync from pack lifecycle events.
 *
 * Delivery:
 * - Malformed records are logged and acknowledged, redelivery would not fix them
 * - Sync results with degraded side channels are acknowledged (the cache window covers retries)
 * - Unexpected failures (e.g. the POS integration lookup) are not acknowledged and get redelivered
 *
 * @author Lottery Back Office Team
 */
@Service
public class PackLifecycleConsumer {

    private static final Logger logger = LoggerFactory.getLogger(PackLifecycleConsumer.class);

    private final PackPosSyncService packPosSyncService;
    private final LotteryMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public PackLifecycleConsumer(
            PackPosSyncService packPosSyncService,
            LotteryMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.packPosSyncService = packPosSyncService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    /**
     * Kafka listener for pack lifecycle events, keyed by pack ID.
     *
     * @param record Consumer record holding a JSON PackLifecycleEvent
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = "${lottery.kafka.pack-events-topic:lottery-pack-events}",
            groupId = "${spring.kafka.consumer.group-id:lottery-pack-sync}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumePackEvent(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        PackLifecycleEvent event;
        try {
            event = objectMapper.readValue(record.value(), PackLifecycleEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Discarding malformed pack event at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getMessage());
            metricsService.recordError("MALFORMED_PACK_EVENT", "consumePackEvent");
            acknowledge(acknowledgment);
            return;
        }

        if (event.getEventType() == null || event.getPackId() == null || event.getStoreId() == null) {
            logger.warn("Discarding incomplete pack event at partition {} offset {}: {}",
                    record.partition(), record.offset(), event);
            metricsService.recordError("MALFORMED_PACK_EVENT", "consumePackEvent");
            acknowledge(acknowledgment);
            return;
        }

        try {
            if (event.getEventType() == PackLifecycleEvent.EventType.ACTIVATED) {
                handleActivation(event);
            } else {
                handleDeactivation(event);
            }
            acknowledge(acknowledgment);
        } catch (Exception e) {
            logger.error("Error syncing pack {} for event {}", event.getPackId(), event.getEventType(), e);
            metricsService.recordError("PACK_SYNC_ERROR", "consumePackEvent");
            // Do not acknowledge - Kafka will redeliver the event
            throw new IllegalStateException("Pack sync failed for pack " + event.getPackId(), e);
        }
    }

    private void handleActivation(PackLifecycleEvent event) {
        PackActivationSyncResult result = packPosSyncService.syncPackActivation(PackActivationSyncInput.builder()
                .packId(event.getPackId())
                .storeId(event.getStoreId())
                .packNumber(event.getPackNumber())
                .gameCode(event.getGameCode())
                .gameName(event.getGameName())
                .ticketsPerPack(event.getTicketsPerPack())
                .ticketPrice(event.getTicketPrice())
                .startingSerial(event.getStartingSerial() != null ? event.getStartingSerial() : 0)
                .userId(event.getUserId())
                .build());

        if (!result.isSuccess()) {
            logger.warn("Activation of pack {} not synced: {}", event.getPackId(), result.getError());
        }
    }

    private void handleDeactivation(PackLifecycleEvent event) {
        PackDeactivationSyncResult result = packPosSyncService.syncPackDeactivation(
                event.getPackId(), event.getStoreId());
        if (result.getError() != null) {
            logger.warn("Deactivation of pack {} partially synced: {}", event.getPackId(), result.getError());
        }
    }

    private static void acknowledge(Acknowledgment acknowledgment) {
        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
    }
}
