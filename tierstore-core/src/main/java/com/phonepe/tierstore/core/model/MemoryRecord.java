package com.phonepe.tierstore.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The unit of storage. A record lives in exactly one tier at a time and its id is never reused.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MemoryRecord {
    @JsonPropertyDescription("Opaque unique identifier, assigned at creation")
    String id;

    @JsonPropertyDescription("Text payload")
    String content;

    @JsonPropertyDescription("Creation time. The only ordering key for records")
    Instant timestamp;

    @JsonPropertyDescription("Keywords extracted from the content")
    @Singular
    Set<String> entities;

    @JsonPropertyDescription("Ids of related records")
    @Singular
    Set<String> connections;

    RecordType recordType;

    @JsonPropertyDescription("Emotional valence in [-1, 1]")
    double valence;

    RecordSource source;

    @JsonPropertyDescription("Confidence in the content, in [0, 1]")
    @Builder.Default
    double confidence = 1.0;

    /**
     * Creates a first hand record with a fresh id
     *
     * @param content  Payload
     * @param entities Extracted entities
     * @param type     Record type
     * @param valence  Emotional valence
     * @param clock    Source of the creation time
     * @return New record with no connections
     */
    public static MemoryRecord create(final String content,
                                      final Collection<String> entities,
                                      final RecordType type,
                                      final double valence,
                                      final Clock clock) {
        return MemoryRecord.builder()
                .id(UUID.randomUUID().toString())
                .content(content)
                .timestamp(now(clock))
                .entities(entities)
                .recordType(type)
                .valence(valence)
                .source(new DirectExperience())
                .build();
    }

    /**
     * Timestamps are kept at millisecond precision so that they survive storage round trips unchanged
     */
    public static Instant now(final Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public RecordSource getSource() {
        return Objects.requireNonNullElseGet(source, DirectExperience::new);
    }
}
