package com.namehub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Registry runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "namehub")
public class NamehubProperties {

    private Payment payment = new Payment();
    private Registration registration = new Registration();
    private Name name = new Name();

    @Getter
    @Setter
    public static class Payment {
        /**
         * Ledger account that registration payments must be sent to.
         */
        private String recipientAddress = "NameHubTreasury1111111111111111111111111111";
    }

    @Getter
    @Setter
    public static class Registration {
        private int subscriptionValidityDays = 365;
    }

    @Getter
    @Setter
    public static class Name {
        private String allowedPattern = "^[a-z0-9](?:[a-z0-9-]*[a-z0-9])?$";
    }
}
