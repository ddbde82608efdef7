package com.phonepe.tierstore.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure categories raised by the stores and the persistence engine
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    DUPLICATE_ID("Record already exists: %s"),
    NOT_FOUND("Record not found: %s"),
    ARCHIVE_NOT_FOUND("Archive file not found: %s"),
    CORRUPT("Could not deserialize %s. Error: %s"),
    IO_FAILURE("Storage operation failed: %s"),
    VALIDATION_FAILURE("State failed validation. Errors: %s"),
    CONSOLIDATION_FAILED("Consolidation aborted, no merges applied. Error: %s"),
    NO_CONSISTENT_STATE("No consistent state found in any of %d locations"),
    ;

    private final String message;
}
