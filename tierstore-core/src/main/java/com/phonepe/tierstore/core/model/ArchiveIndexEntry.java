package com.phonepe.tierstore.core.model;

import com.phonepe.tierstore.core.utils.StoreUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Denormalized projection of an archived record. Lets the archive be searched without opening archive files. Created
 * once when the record is evicted and never changed afterwards.
 */
@Value
@Builder
@Jacksonized
public class ArchiveIndexEntry {
    public static final int PREVIEW_LENGTH = 200;

    String id;
    /**
     * Archive file holding the full record, relative to the archive root
     */
    String filePath;
    Instant timestamp;
    @Singular
    List<String> entities;
    double valence;
    RecordType recordType;
    String contentPreview;
    @Singular
    List<String> connections;

    public static ArchiveIndexEntry of(final MemoryRecord record, final String filePath) {
        return ArchiveIndexEntry.builder()
                .id(record.getId())
                .filePath(filePath)
                .timestamp(record.getTimestamp())
                .entities(record.getEntities())
                .valence(record.getValence())
                .recordType(record.getRecordType())
                .contentPreview(StoreUtils.prefix(record.getContent(), PREVIEW_LENGTH))
                .connections(record.getConnections())
                .build();
    }
}
