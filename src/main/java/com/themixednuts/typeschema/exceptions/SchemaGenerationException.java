package com.themixednuts.typeschema.exceptions;

import com.themixednuts.typeschema.models.SchemaGenerationError;

/**
 * Checked exception raised when a type cannot be converted into a schema.
 * Each layer of the walk wraps the failure from below with its own position
 * (property, then type, then definition or root), so the cause chain reads
 * from the outermost context down to the malformed annotation.
 */
public class SchemaGenerationException extends Exception {

    private final SchemaGenerationError err;

    /**
     * Creates a new exception with structured error information.
     *
     * @param err The detailed error information
     */
    public SchemaGenerationException(SchemaGenerationError err) {
        super(err.getMessage());
        this.err = err;
    }

    /**
     * Creates a new exception with structured error information and a cause.
     *
     * @param structuredError The detailed error information
     * @param cause           The underlying exception that caused this error
     */
    public SchemaGenerationException(SchemaGenerationError structuredError, Throwable cause) {
        super(structuredError.getMessage(), cause);
        this.err = structuredError;
    }

    /**
     * Gets the structured error information for this layer.
     *
     * @return The error information
     */
    public SchemaGenerationError getErr() {
        return err;
    }

    /**
     * Gets the error code of this layer.
     *
     * @return The error code
     */
    public SchemaGenerationError.ErrorCode getErrorCode() {
        return err.getErrorCode();
    }

    /**
     * Gets the error type of this layer.
     *
     * @return The error type
     */
    public SchemaGenerationError.ErrorType getErrorType() {
        return err.getErrorType();
    }

    /**
     * Walks the cause chain and returns the innermost structured error, which
     * names the annotation or literal that could not be handled.
     *
     * @return The innermost error; this layer's error when nothing is wrapped
     */
    public SchemaGenerationError getOriginalError() {
        SchemaGenerationError original = err;
        Throwable cause = getCause();
        while (cause != null) {
            if (cause instanceof SchemaGenerationException) {
                original = ((SchemaGenerationException) cause).getErr();
            }
            cause = cause.getCause();
        }
        return original;
    }

    /**
     * Checks if the innermost failure came from annotation extraction.
     *
     * @return true if a default or extensions annotation was malformed
     */
    public boolean isExtractionError() {
        return getOriginalError().getErrorType() == SchemaGenerationError.ErrorType.EXTRACTION;
    }
}
