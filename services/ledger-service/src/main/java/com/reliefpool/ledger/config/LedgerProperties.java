package com.reliefpool.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger service settings, bound from {@code reliefpool.ledger.*}.
 */
@Data
@ConfigurationProperties(prefix = "reliefpool.ledger")
public class LedgerProperties {

    private Store store = new Store();
    private Epoch epoch = new Epoch();
    private Audit audit = new Audit();

    @Data
    public static class Store {
        /**
         * Longest an operation waits for a center held by another operation.
         */
        private Duration lockTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Epoch {
        private long initial = 0L;
    }

    @Data
    public static class Audit {
        private Sink sink = Sink.LOG;
        private String topic = "relief-ledger-audit";
    }

    public enum Sink {
        LOG,
        KAFKA
    }
}
