package com.reliefpool.ledger;

import com.reliefpool.ledger.audit.AuditEventEmitter;
import com.reliefpool.ledger.audit.LoggingAuditEventEmitter;
import com.reliefpool.ledger.config.LedgerProperties;
import com.reliefpool.ledger.context.LogicalEpochClock;
import com.reliefpool.ledger.context.OperationContext;
import com.reliefpool.ledger.domain.CenterRegistration;
import com.reliefpool.ledger.service.CenterRegistryService;
import com.reliefpool.ledger.service.ContributionService;
import com.reliefpool.ledger.service.FundsMovementService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "reliefpool.ledger.audit.sink=log",
        "reliefpool.ledger.store.lock-timeout=2s"
})
class LedgerServiceApplicationTests {

    @Autowired
    private CenterRegistryService registry;

    @Autowired
    private ContributionService contributions;

    @Autowired
    private FundsMovementService movements;

    @Autowired
    private AuditEventEmitter auditEventEmitter;

    @Autowired
    private LedgerProperties properties;

    @Autowired
    private LogicalEpochClock clock;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads() {
        assertThat(auditEventEmitter).isInstanceOf(LoggingAuditEventEmitter.class);
        assertThat(properties.getStore().getLockTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getAudit().getTopic()).isEqualTo("relief-ledger-audit");
    }

    @Test
    void fundsFlowThroughWiredServices() {
        CenterRegistration shelter = registry.createCenter("Shelter-A", OperationContext.of("relief-admin", clock));
        CenterRegistration depot = registry.createCenter("Depot-B", OperationContext.of("relief-admin", clock));
        UUID shelterId = shelter.center().id();
        UUID depotId = depot.center().id();

        clock.advance();
        contributions.donate(shelterId, 100L, OperationContext.of("donor-d", clock));
        movements.transferBetweenCenters(shelterId, depotId, 40L, shelter.capability(),
                OperationContext.of("relief-admin", clock));
        movements.withdrawFunds(depotId, 15L, "field-team", depot.capability(),
                OperationContext.of("relief-admin", clock));

        assertThat(registry.balanceOf(shelterId)).isEqualTo(60L);
        assertThat(registry.balanceOf(depotId)).isEqualTo(25L);
        assertThat(registry.tokenSupply(shelterId)).isEqualTo(100L);
        assertThat(meterRegistry.get("ledger.donations").counter().count()).isGreaterThanOrEqualTo(1.0);
    }
}
