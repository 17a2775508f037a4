package com.reliefpool.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reliefpool.ledger.audit.AuditEventEmitter;
import com.reliefpool.ledger.audit.KafkaAuditEventEmitter;
import com.reliefpool.ledger.audit.LoggingAuditEventEmitter;
import com.reliefpool.ledger.context.LogicalEpochClock;
import com.reliefpool.ledger.store.InMemoryLedgerStore;
import com.reliefpool.ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Wires the ledger store, the audit sink and the logical epoch clock.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    @Bean
    public LogicalEpochClock logicalEpochClock(LedgerProperties properties) {
        return new LogicalEpochClock(properties.getEpoch().getInitial());
    }

    /**
     * Audit sink selected by {@code reliefpool.ledger.audit.sink}. The Kafka sink falls back
     * to the application log for records it cannot deliver.
     */
    @Bean
    public AuditEventEmitter auditEventEmitter(LedgerProperties properties,
                                               ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
                                               ObjectMapper objectMapper) {
        LedgerProperties.Audit audit = properties.getAudit();
        switch (audit.getSink()) {
            case KAFKA:
                log.info("Audit records will be published to Kafka topic {}", audit.getTopic());
                return new KafkaAuditEventEmitter(kafkaTemplate.getObject(), objectMapper, audit.getTopic(),
                        new LoggingAuditEventEmitter());
            case LOG:
            default:
                log.info("Audit records will be written to the application log");
                return new LoggingAuditEventEmitter();
        }
    }

    @Bean
    public LedgerStore ledgerStore(LedgerProperties properties, AuditEventEmitter auditEventEmitter) {
        return new InMemoryLedgerStore(properties.getStore().getLockTimeout(), auditEventEmitter);
    }
}
