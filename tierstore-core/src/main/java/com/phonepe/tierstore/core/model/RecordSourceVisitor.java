package com.phonepe.tierstore.core.model;

/**
 *
 */
public interface RecordSourceVisitor<T> {
    T visit(DirectExperience directExperience);

    T visit(Researched researched);
}
