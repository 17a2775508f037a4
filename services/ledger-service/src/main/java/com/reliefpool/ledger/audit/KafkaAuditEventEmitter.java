package com.reliefpool.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefpool.ledger.exception.AuditPublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes audit records to a Kafka topic as JSON.
 *
 * Records are keyed by their primary center id so that all records of one center land on
 * one partition and keep the order in which they were emitted.
 */
@Slf4j
public class KafkaAuditEventEmitter implements AuditEventEmitter {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final AuditEventEmitter fallback;

    public KafkaAuditEventEmitter(KafkaTemplate<String, String> kafkaTemplate,
                                  ObjectMapper objectMapper,
                                  String topic,
                                  AuditEventEmitter fallback) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.fallback = fallback;
    }

    @Override
    public void emit(AuditRecord record) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new AuditPublishException(record.getRecordId(), record.getRecordType().name(), e);
        }

        String key = record.getPrimaryCenterId().toString();
        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, payload);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish audit record to Kafka: topic={}, type={}, recordId={}",
                        topic, record.getRecordType(), record.getRecordId(), ex);
                fallback.emit(record);
            } else {
                log.debug("Audit record published: topic={}, type={}, recordId={}, offset={}",
                        topic, record.getRecordType(), record.getRecordId(),
                        result != null && result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : -1);
            }
        });
    }
}
