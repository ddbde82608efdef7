package com.phonepe.tierstore.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Provenance of a record. Carried unchanged through eviction, consolidation and migration.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = "DIRECT_EXPERIENCE", value = DirectExperience.class),
        @JsonSubTypes.Type(name = "RESEARCHED", value = Researched.class),
})
public abstract class RecordSource {
    private final SourceType type;

    public abstract <T> T accept(RecordSourceVisitor<T> visitor);
}
