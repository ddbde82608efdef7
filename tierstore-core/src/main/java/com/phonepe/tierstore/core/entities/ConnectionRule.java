package com.phonepe.tierstore.core.entities;

import com.phonepe.tierstore.core.model.MemoryRecord;
import lombok.Value;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which existing records a new record is related to. Two records are connected when their entity overlap
 * exceeds {@code strongOverlap}, or exceeds {@code weakOverlap} while their valences differ by less than
 * {@code valenceTolerance}.
 */
@Value
public class ConnectionRule {
    double strongOverlap;
    double weakOverlap;
    double valenceTolerance;

    public boolean connected(final MemoryRecord lhs, final MemoryRecord rhs) {
        final var overlap = EntityOverlap.ratio(lhs.getEntities(), rhs.getEntities());
        if (overlap > strongOverlap) {
            return true;
        }
        return overlap > weakOverlap && Math.abs(lhs.getValence() - rhs.getValence()) < valenceTolerance;
    }

    /**
     * @param record   Record being added
     * @param existing Records currently in the active tier
     * @return The record's existing connections plus the ids of every connected existing record
     */
    public Set<String> connections(final MemoryRecord record, final Collection<MemoryRecord> existing) {
        final var connections = new LinkedHashSet<>(record.getConnections());
        existing.stream()
                .filter(candidate -> !Objects.equals(candidate.getId(), record.getId()))
                .filter(candidate -> connected(record, candidate))
                .forEach(candidate -> connections.add(candidate.getId()));
        return connections;
    }
}
