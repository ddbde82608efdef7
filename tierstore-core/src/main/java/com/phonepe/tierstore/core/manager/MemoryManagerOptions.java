package com.phonepe.tierstore.core.manager;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.phonepe.tierstore.core.entities.ConnectionRule;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tunables for {@link MemoryManager}. Connection and consolidation thresholds are deliberately separate settings even
 * though both default to 0.7.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MemoryManagerOptions {

    @JsonPropertyDescription("Maximum number of records kept in the active tier before eviction kicks in")
    @Builder.Default
    int activeLimit = 200;

    @JsonPropertyDescription("Number of oldest records moved to the archive when the active limit is exceeded")
    @Builder.Default
    int evictionBatchSize = 50;

    @JsonPropertyDescription("Entity overlap above which two records are always connected")
    @Builder.Default
    double connectionStrongOverlap = 0.7;

    @JsonPropertyDescription("Entity overlap above which records with similar valence are connected")
    @Builder.Default
    double connectionWeakOverlap = 0.3;

    @JsonPropertyDescription("Maximum valence difference for the weak overlap connection")
    @Builder.Default
    double connectionValenceTolerance = 0.3;

    @JsonPropertyDescription("Entity overlap above which two active records are merged during consolidation")
    @Builder.Default
    double consolidationOverlap = 0.7;

    @JsonPropertyDescription("Maximum number of characters of an absorbed record copied into the survivor")
    @Builder.Default
    int mergeExcerptLength = 150;

    @JsonPropertyDescription("Maximum number of archive files opened by a single recall")
    @Builder.Default
    int archiveFilesPerRecall = 3;

    public static MemoryManagerOptions defaults() {
        return MemoryManagerOptions.builder().build();
    }

    public ConnectionRule connectionRule() {
        return new ConnectionRule(connectionStrongOverlap, connectionWeakOverlap, connectionValenceTolerance);
    }
}
