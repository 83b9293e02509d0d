package com.prediction.worthhub.worth_hub;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoProperties;
import org.springframework.stereotype.Component;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@ConditionalOnProperty(name = "worthhub.ledger.store", havingValue = "mongo", matchIfMissing = true)
public class MongoStartUpCheck {

    @Autowired
    MongoClient mongoClient;

    @Autowired
    MongoProperties mongoProperties;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            MongoDatabase database = mongoClient.getDatabase(mongoProperties.getMongoClientDatabase());
            MongoCollection<Document> topics = database.getCollection("topics");
            long count = topics.countDocuments();
            Document latest = topics.find().sort(new Document("topicId", -1)).first();
            log.info("MongoDB connection successful: database={}, topics={}, latestTopicId={}",
                    database.getName(), count, latest != null ? latest.get("topicId") : "none");
        } catch (Exception e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
