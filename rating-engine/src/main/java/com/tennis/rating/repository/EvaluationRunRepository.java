package com.tennis.rating.repository;

import com.tennis.rating.model.EvaluationRunDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EvaluationRunRepository extends MongoRepository<EvaluationRunDocument, String> {

    Optional<EvaluationRunDocument> findByRunId(String runId);

    List<EvaluationRunDocument> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
