package com.prediction.worthhub.worth_hub.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.worthhub.worth_hub.entity.Escrow;

@Repository
public interface EscrowRepository extends MongoRepository<Escrow, String> {
}
