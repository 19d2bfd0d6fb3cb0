package com.namehub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * External payment ledger connection settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * {@code solana} queries a live cluster, {@code mock} serves transfers recorded in memory.
     */
    private String mode = "mock";

    private String network = "devnet";

    private String rpcUrl = "https://api.devnet.solana.com";
}
