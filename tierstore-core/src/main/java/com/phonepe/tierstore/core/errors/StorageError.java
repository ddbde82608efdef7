package com.phonepe.tierstore.core.errors;

import lombok.Getter;

/**
 * Error raised by a store or by the persistence engine
 */
@Getter
public class StorageError extends RuntimeException {
    private final ErrorType errorType;

    public StorageError(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public static StorageError error(ErrorType errorType, Object... args) {
        return new StorageError(errorType, String.format(errorType.getMessage(), args), null);
    }

    public static StorageError error(ErrorType errorType, Throwable cause, Object... args) {
        return new StorageError(errorType, String.format(errorType.getMessage(), args), cause);
    }

    /**
     * Wraps a low level failure as {@link ErrorType#IO_FAILURE} using the innermost cause message
     */
    public static StorageError ioFailure(Throwable throwable) {
        if (throwable instanceof StorageError storageError) {
            return storageError;
        }
        var message = throwable.getMessage();
        var cause = throwable.getCause();
        while (cause != null) {
            if (cause.getMessage() != null) {
                message = cause.getMessage();
            }
            cause = cause.getCause();
        }
        return error(ErrorType.IO_FAILURE, throwable, message);
    }
}
