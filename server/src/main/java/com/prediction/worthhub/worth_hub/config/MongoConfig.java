package com.prediction.worthhub.worth_hub.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.prediction.worthhub.worth_hub.ledger.LedgerStore;
import com.prediction.worthhub.worth_hub.ledger.MongoLedgerStore;
import com.prediction.worthhub.worth_hub.repositories.CommitmentRepository;
import com.prediction.worthhub.worth_hub.repositories.EscrowRepository;
import com.prediction.worthhub.worth_hub.repositories.EscrowTransferRepository;
import com.prediction.worthhub.worth_hub.repositories.TopicRepository;

/**
 * Mongo ledger. Multi-document transactions need a replica set
 * (a single-node replica set is enough for development).
 */
@Configuration
@ConditionalOnProperty(name = "worthhub.ledger.store", havingValue = "mongo", matchIfMissing = true)
public class MongoConfig {

    @Bean
    MongoClient mongoClient(MongoProperties mongoProperties) {
        return MongoClients.create(mongoProperties.getUri());
    }

    @Bean
    MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public LedgerStore mongoLedgerStore(
            TopicRepository topicRepository,
            CommitmentRepository commitmentRepository,
            EscrowRepository escrowRepository,
            EscrowTransferRepository escrowTransferRepository,
            MongoTransactionManager mongoTransactionManager) {
        return new MongoLedgerStore(
                topicRepository,
                commitmentRepository,
                escrowRepository,
                escrowTransferRepository,
                new TransactionTemplate(mongoTransactionManager));
    }
}
