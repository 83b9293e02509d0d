package com.prediction.worthhub.worth_hub.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.worthhub.worth_hub.entity.Commitment;

@Repository
public interface CommitmentRepository extends MongoRepository<Commitment, String> {

    /**
     * All commitments of a topic in submit order.
     */
    List<Commitment> findByTopicAddressOrderBySubmitOrderAsc(String topicAddress);
}
