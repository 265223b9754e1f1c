package com.tennis.matchdata.repository;

import com.tennis.matchdata.model.MatchDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MatchRepository extends MongoRepository<MatchDocument, String> {

    Optional<MatchDocument> findByMatchKey(String matchKey);

    /**
     * Matches by date range (inclusive on both ends).
     */
    @Query("{ 'matchDate': { $gte: ?0, $lte: ?1 } }")
    Page<MatchDocument> findByMatchDateBetween(LocalDate start, LocalDate end, Pageable pageable);

    @Query("{ $or: [ {'playerAKey': ?0}, {'playerBKey': ?0} ] }")
    List<MatchDocument> findByPlayerKey(String playerKey);

    long countBySourceYear(int sourceYear);

    long countBySourceYearAndTier(int sourceYear, String tier);
}
