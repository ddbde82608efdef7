package com.phonepe.tierstore.core.config;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.phonepe.tierstore.core.manager.MemoryManagerOptions;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Top level configuration, read from a JSON file by {@link ConfigLoader}
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TierStoreConfig {

    @JsonPropertyDescription("Directory holding the active database, the archive index and the archive files")
    @Builder.Default
    String dataDir = "data";

    @Builder.Default
    MemoryManagerOptions memory = MemoryManagerOptions.defaults();

    @JsonPropertyDescription("Root directory for state snapshots")
    @Builder.Default
    String snapshotDir = "data/state";

    @JsonPropertyDescription("Interval between background state snapshots in milliseconds")
    @Builder.Default
    long snapshotIntervalMs = 30_000;

    @JsonPropertyDescription("Number of dated snapshots kept in the snapshot archive")
    @Builder.Default
    int snapshotRetention = 100;

    public static TierStoreConfig defaults() {
        return TierStoreConfig.builder().build();
    }
}
