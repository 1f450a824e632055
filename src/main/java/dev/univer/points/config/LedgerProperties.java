package dev.univer.points.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Getter @Setter
public class LedgerProperties {
    private double defaultCommissionRate = 0.10;
    private String defaultRules = "";
    private Retry retry = new Retry();

    @Getter @Setter
    public static class Retry {
        private int maxAttempts = 5;
        private long delayMs = 20;
        private double multiplier = 2.0;
        private long maxDelayMs = 500;
    }
}
