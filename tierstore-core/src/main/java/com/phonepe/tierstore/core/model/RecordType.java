package com.phonepe.tierstore.core.model;

import java.util.Map;

/**
 * Kind of experience a record captures
 */
public enum RecordType {
    INTERACTION,
    REFLECTION,
    CURIOSITY,
    EMOTIONAL_STATE,
    WISDOM_TRANSFORMATION,
    EXISTENTIAL_REFLECTION,
    ;

    private static final Map<String, RecordType> LEGACY_NAMES = Map.of(
            "Interaction", INTERACTION,
            "Reflection", REFLECTION,
            "Curiosity", CURIOSITY,
            "EmotionalState", EMOTIONAL_STATE,
            "WisdomTransformation", WISDOM_TRANSFORMATION,
            "ExistentialReflection", EXISTENTIAL_REFLECTION);

    /**
     * Maps the CamelCase names used by the single file record stream. Anything unrecognised is treated as an
     * interaction.
     *
     * @param name Legacy type name
     * @return Matching type
     */
    public static RecordType fromLegacyName(final String name) {
        if (name == null) {
            return INTERACTION;
        }
        final var legacy = LEGACY_NAMES.get(name);
        if (legacy != null) {
            return legacy;
        }
        for (final var type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return INTERACTION;
    }
}
