package com.reliefpool.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefpool.common.exception.ErrorCode;
import com.reliefpool.ledger.exception.AuditPublishException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Kafka Audit Event Emitter Tests")
class KafkaAuditEventEmitterTest {

    private static final String TOPIC = "relief-ledger-audit";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private AuditEventEmitter fallback;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private KafkaAuditEventEmitter emitter;
    private UUID centerId;
    private DonationReceivedRecord record;

    @BeforeEach
    void setUp() {
        emitter = new KafkaAuditEventEmitter(kafkaTemplate, objectMapper, TOPIC, fallback);
        centerId = UUID.randomUUID();
        record = DonationReceivedRecord.builder()
                .centerId(centerId)
                .donor("donor-d")
                .amount(100L)
                .epoch(3L)
                .sequence(0)
                .build();
    }

    @Test
    @DisplayName("Publishes JSON keyed by the center id")
    void publishesKeyedJson() throws Exception {
        CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(sent);

        emitter.emit(record);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq(centerId.toString()), payload.capture());
        verifyNoInteractions(fallback);

        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("recordType").asText()).isEqualTo("DONATION_RECEIVED");
        assertThat(json.get("amount").asLong()).isEqualTo(100L);
        assertThat(json.get("epoch").asLong()).isEqualTo(3L);
        assertThat(json.get("sequence").asInt()).isZero();
        assertThat(json.get("donor").asText()).isEqualTo("donor-d");
        assertThat(json.get("recordId").asText()).isEqualTo(record.getRecordId().toString());
        assertThat(json.has("primaryCenterId")).isFalse();
    }

    @Test
    @DisplayName("Falls back to the secondary sink when the send fails")
    void fallsBackOnSendFailure() {
        CompletableFuture<SendResult<String, String>> failed =
                CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(failed);

        emitter.emit(record);

        verify(fallback).emit(record);
    }

    @Test
    @DisplayName("Serialization failure surfaces as an audit publish error")
    void serializationFailure() throws Exception {
        ObjectMapper brokenMapper = mock(ObjectMapper.class);
        when(brokenMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("cannot serialize") { });
        KafkaAuditEventEmitter brokenEmitter = new KafkaAuditEventEmitter(kafkaTemplate, brokenMapper, TOPIC, fallback);

        assertThatThrownBy(() -> brokenEmitter.emit(record))
                .isInstanceOf(AuditPublishException.class)
                .satisfies(ex -> {
                    AuditPublishException publish = (AuditPublishException) ex;
                    assertThat(publish.getErrorCode()).isEqualTo(ErrorCode.LEDGER_AUDIT_PUBLISH_FAILED);
                    assertThat(publish.getMetadata()).containsEntry("recordId", record.getRecordId());
                    assertThat(publish.getCause()).isInstanceOf(JsonProcessingException.class);
                });
        verifyNoInteractions(kafkaTemplate);
    }
}
