package com.phonepe.tierstore.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.phonepe.tierstore.core.utils.TestUtils.EPOCH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryRecordSerializationTest {
    private final ObjectMapper mapper = JsonUtils.createMapper();

    @Test
    void testResearchedSourceSurvivesStorage() {
        final var record = MemoryRecord.builder()
                .id("r-1")
                .content("tides are driven by the Moon")
                .timestamp(EPOCH)
                .entity("Moon")
                .connection("r-0")
                .recordType(RecordType.CURIOSITY)
                .valence(0.3)
                .confidence(0.8)
                .source(new Researched("encyclopedia", "why are there tides", EPOCH.minusSeconds(60)))
                .build();
        final var json = new String(JsonUtils.write(mapper, record), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"type\":\"RESEARCHED\""));
        assertTrue(json.contains("2025-03-01T10:00:00Z"));

        final var read = JsonUtils.read(mapper, json.getBytes(StandardCharsets.UTF_8), MemoryRecord.class, "record");
        assertEquals(record, read);
        final var source = assertInstanceOf(Researched.class, read.getSource());
        assertEquals("why are there tides", source.getOriginalQuery());
    }

    @Test
    void testMissingSourceMeansDirectExperience() {
        final var json = """
                [{"id": "r-2", "content": "hello", "timestamp": "2025-03-01T10:00:00Z",
                  "recordType": "interaction", "valence": 0.1}]
                """;
        final var records = JsonUtils.read(mapper,
                                           json.getBytes(StandardCharsets.UTF_8),
                                           new TypeReference<List<MemoryRecord>>() {},
                                           "records");
        assertEquals(1, records.size());
        assertInstanceOf(DirectExperience.class, records.get(0).getSource());
        assertEquals(1.0, records.get(0).getConfidence());
        assertEquals(RecordType.INTERACTION, records.get(0).getRecordType());
        assertTrue(records.get(0).getEntities().isEmpty());
    }

    @Test
    void testLegacyTypeNames() {
        assertEquals(RecordType.EMOTIONAL_STATE, RecordType.fromLegacyName("EmotionalState"));
        assertEquals(RecordType.WISDOM_TRANSFORMATION, RecordType.fromLegacyName("wisdom_transformation"));
        assertEquals(RecordType.INTERACTION, RecordType.fromLegacyName("Daydream"));
        assertEquals(RecordType.INTERACTION, RecordType.fromLegacyName(null));
    }

    @Test
    void testGarbageIsCorrupt() {
        final var error = assertThrows(StorageError.class,
                                       () -> JsonUtils.read(mapper, "[{".getBytes(StandardCharsets.UTF_8),
                                                            MemoryRecord.class, "archive_x.json"));
        assertEquals(ErrorType.CORRUPT, error.getErrorType());
        assertTrue(error.getMessage().contains("archive_x.json"));
    }
}
