package com.tennis.rating.repository;

import com.tennis.rating.model.PredictionResultDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Full read/write repository for evaluation predictions.
 */
@Repository
public interface PredictionResultRepository extends MongoRepository<PredictionResultDocument, String> {

    List<PredictionResultDocument> findByRunIdOrderByMatchDateAsc(String runId);
}
