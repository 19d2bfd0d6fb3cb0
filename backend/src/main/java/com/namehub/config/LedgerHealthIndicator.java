package com.namehub.config;

import com.namehub.ledger.LedgerClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerClient ledgerClient;
    private final LedgerProperties ledgerProperties;

    public LedgerHealthIndicator(LedgerClient ledgerClient, LedgerProperties ledgerProperties) {
        this.ledgerClient = ledgerClient;
        this.ledgerProperties = ledgerProperties;
    }

    @Override
    public Health health() {
        try {
            LedgerClient.LedgerProbe probe = ledgerClient.probe();
            return Health.up()
                    .withDetail("mode", ledgerProperties.getMode())
                    .withDetail("network", ledgerProperties.getNetwork())
                    .withDetail("latestHash", probe.latestHash())
                    .withDetail("height", probe.height())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("mode", ledgerProperties.getMode())
                    .withDetail("network", ledgerProperties.getNetwork())
                    .withException(e)
                    .build();
        }
    }
}
