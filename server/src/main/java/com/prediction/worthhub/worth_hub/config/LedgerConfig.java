package com.prediction.worthhub.worth_hub.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.worthhub.worth_hub.crypto.CommitmentScheme;
import com.prediction.worthhub.worth_hub.engine.SettlementEngine;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.ledger.InMemoryLedgerStore;
import com.prediction.worthhub.worth_hub.ledger.LedgerStore;
import com.prediction.worthhub.worth_hub.service.EscrowService;
import com.prediction.worthhub.worth_hub.service.TopicValidator;

@Configuration
@EnableConfigurationProperties(WorthHubProperties.class)
public class LedgerConfig {

    @Bean
    Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "worthhub.ledger.store", havingValue = "memory")
    public LedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    CommitmentScheme commitmentScheme() {
        return new CommitmentScheme();
    }

    @Bean
    SettlementEngine settlementEngine() {
        return new SettlementEngine();
    }

    @Bean
    public TopicValidator topicValidator(WorthHubProperties properties) {
        return new TopicValidator(
                properties.getTopic().getMaxDescriptionBytes(),
                properties.getTopic().getMaxSymbolBytes());
    }

    @Bean
    public EscrowService escrowService(LedgerStore ledgerStore) {
        return new EscrowService(ledgerStore);
    }

    @Bean
    public TopicStateMachine topicStateMachine(
            LedgerStore ledgerStore,
            CommitmentScheme commitmentScheme,
            SettlementEngine settlementEngine,
            TopicValidator topicValidator,
            EscrowService escrowService,
            Clock ledgerClock,
            WorthHubProperties properties) {
        return new TopicStateMachine(
                ledgerStore,
                commitmentScheme,
                settlementEngine,
                topicValidator,
                escrowService,
                ledgerClock,
                properties.getEscrow().getReserveLamports(),
                properties.getSettlement().getMaxPayoutsPerWrite());
    }
}
