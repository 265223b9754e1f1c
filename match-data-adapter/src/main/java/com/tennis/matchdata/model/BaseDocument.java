package com.tennis.matchdata.model;

import org.bson.Document;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Base class for stored documents. Keeps the source columns as a BSON document.
 */
public abstract class BaseDocument {

    @Id
    private String id;

    /**
     * The source columns of the record, as read
     */
    private Document raw;

    private Instant fetchedAt;

    private Instant updatedAt;

    public BaseDocument() {
        this.fetchedAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Document getRaw() {
        return raw;
    }

    public void setRaw(Document raw) {
        this.raw = raw;
        this.updatedAt = Instant.now();
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public void setFetchedAt(Instant fetchedAt) {
        this.fetchedAt = fetchedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
