package com.phonepe.tierstore.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Record whose content was looked up externally
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Researched extends RecordSource {
    /**
     * Where the content came from, for example a knowledge base name or a URL
     */
    String origin;
    /**
     * The query that produced the content
     */
    String originalQuery;
    /**
     * When the lookup happened
     */
    Instant researchedAt;

    @JsonCreator
    public Researched(@JsonProperty("origin") String origin,
                      @JsonProperty("originalQuery") String originalQuery,
                      @JsonProperty("researchedAt") Instant researchedAt) {
        super(SourceType.RESEARCHED);
        this.origin = origin;
        this.originalQuery = originalQuery;
        this.researchedAt = researchedAt;
    }

    @Override
    public <T> T accept(RecordSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
