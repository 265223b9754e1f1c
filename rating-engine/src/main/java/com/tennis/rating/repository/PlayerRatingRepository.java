package com.tennis.rating.repository;

import com.tennis.rating.model.PlayerRatingDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for exported player ratings.
 */
@Repository
public interface PlayerRatingRepository extends MongoRepository<PlayerRatingDocument, String> {

    Optional<PlayerRatingDocument> findByPlayerKey(String playerKey);

    // Leaderboard
    List<PlayerRatingDocument> findAllByOrderByRankAsc(Pageable pageable);

    @Query("{ 'matchesPlayed': { $gte: ?0 } }")
    List<PlayerRatingDocument> findByMinMatchesPlayed(int minMatches, Pageable pageable);

    @Query("{ 'playerName': { $regex: ?0, $options: 'i' } }")
    List<PlayerRatingDocument> searchByName(String namePattern);
}
