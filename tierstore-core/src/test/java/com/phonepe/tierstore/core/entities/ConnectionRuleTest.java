package com.phonepe.tierstore.core.entities;

import com.phonepe.tierstore.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.phonepe.tierstore.core.utils.TestUtils.EPOCH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRuleTest {
    private final ConnectionRule rule = new ConnectionRule(0.7, 0.3, 0.3);

    @Test
    void testOverlapRatioUsesUnion() {
        assertEquals(0.5, EntityOverlap.ratio(Set.of("Paris"), Set.of("Paris", "France")), 1e-9);
        assertEquals(1.0, EntityOverlap.ratio(Set.of("Paris"), Set.of("Paris")), 1e-9);
        assertEquals(0.0, EntityOverlap.ratio(Set.of(), Set.of()), 1e-9);
        assertEquals(0.0, EntityOverlap.ratio(Set.of("Rome"), Set.of("Paris")), 1e-9);
    }

    @Test
    void testStrongOverlapConnectsRegardlessOfValence() {
        final var lhs = TestUtils.record("a", EPOCH, -0.9, "Paris");
        final var rhs = TestUtils.record("b", EPOCH, 0.9, "Paris");
        assertTrue(rule.connected(lhs, rhs));
    }

    @Test
    void testWeakOverlapNeedsSimilarValence() {
        final var base = TestUtils.record("a", EPOCH, 0.2, "Paris");
        final var close = TestUtils.record("b", EPOCH, 0.4, "Paris", "France");
        final var far = TestUtils.record("c", EPOCH, 0.6, "Paris", "France");
        assertTrue(rule.connected(base, close));
        assertFalse(rule.connected(base, far));
    }

    @Test
    void testLowOverlapNeverConnects() {
        final var lhs = TestUtils.record("a", EPOCH, 0.2, "Paris", "France", "Europe", "Seine");
        final var rhs = TestUtils.record("b", EPOCH, 0.2, "Paris", "Rome", "Italy", "Tiber");
        assertFalse(rule.connected(lhs, rhs));
    }

    @Test
    void testConnectionsSkipSelfAndKeepExisting() {
        final var record = TestUtils.record("a", EPOCH, 0.0, "Paris")
                .toBuilder()
                .connection("earlier-link")
                .build();
        final var related = TestUtils.record("b", EPOCH, 0.0, "Paris");
        final var unrelated = TestUtils.record("c", EPOCH, 0.0, "Tokyo");
        final var connections = rule.connections(record, List.of(record, related, unrelated));
        assertEquals(List.of("earlier-link", related.getId()), List.copyOf(connections));
    }
}
