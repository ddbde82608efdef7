package com.phonepe.tierstore.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Record produced first hand
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DirectExperience extends RecordSource {

    public DirectExperience() {
        super(SourceType.DIRECT_EXPERIENCE);
    }

    @Override
    public <T> T accept(RecordSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
