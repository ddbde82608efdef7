package com.phonepe.tierstore.core.entities;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.HashSet;

/**
 * Similarity between two entity sets
 */
@UtilityClass
public class EntityOverlap {

    /**
     * Jaccard ratio: shared entities divided by the size of the union. Two empty sets have a ratio of 0.
     */
    public static double ratio(final Collection<String> lhs, final Collection<String> rhs) {
        final var union = new HashSet<>(lhs);
        union.addAll(rhs);
        if (union.isEmpty()) {
            return 0.0;
        }
        final var shared = new HashSet<>(lhs);
        shared.retainAll(rhs);
        return (double) shared.size() / union.size();
    }
}
