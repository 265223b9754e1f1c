package com.tennis.rating.repository.readonly;

import com.tennis.rating.model.readonly.MatchDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only repository for matches. The collection is owned by the match data adapter.
 */
@Repository
public interface MatchReadRepository extends MongoRepository<MatchDocument, String> {

    @Query("{ 'matchDate': { $gte: ?0, $lte: ?1 } }")
    List<MatchDocument> findByDateRange(LocalDate start, LocalDate end, Sort sort);

    @Query(value = "{ 'matchDate': { $gte: ?0, $lte: ?1 } }", count = true)
    long countByDateRange(LocalDate start, LocalDate end);
}
