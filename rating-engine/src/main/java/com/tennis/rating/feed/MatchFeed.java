package com.tennis.rating.feed;

/**
 * Source of normalized match records for a year range.
 */
public interface MatchFeed {

    /**
     * Load every completed match dated within {@code [yearFrom-01-01, yearTo-12-31]},
     * ordered by date.
     *
     * @throws com.tennis.rating.exception.ConfigurationException if a record names an unknown tier
     */
    MatchFeedResult load(int yearFrom, int yearTo);
}
