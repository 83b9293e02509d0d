package com.prediction.worthhub.worth_hub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings under the {@code worthhub} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "worthhub")
public class WorthHubProperties {

    private Ledger ledger = new Ledger();
    private TopicLimits topic = new TopicLimits();
    private EscrowSettings escrow = new EscrowSettings();
    private Settlement settlement = new Settlement();
    private Security security = new Security();
    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class Ledger {
        /** mongo or memory */
        private String store = "mongo";
    }

    @Getter
    @Setter
    public static class TopicLimits {
        private int maxDescriptionBytes = 256;
        private int maxSymbolBytes = 32;
    }

    @Getter
    @Setter
    public static class EscrowSettings {
        /** Minimum balance every vault keeps (lamports of a zero-data account). */
        private long reserveLamports = 890_880L;
    }

    @Getter
    @Setter
    public static class Settlement {
        /** Payouts per ledger write; 0 settles everything in one write. */
        private int maxPayoutsPerWrite = 0;
    }

    @Getter
    @Setter
    public static class Security {
        private String jwtSecret;
        private Duration tokenTtl = Duration.ofHours(12);
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int instructionsPerSecond = 10;
        private Duration timeout = Duration.ZERO;
    }
}
