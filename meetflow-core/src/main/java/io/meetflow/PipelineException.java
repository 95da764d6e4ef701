package io.meetflow;

/**
 * Unchecked failure raised by pipeline facades when the backing datastore cannot be reached
 * or a store operation fails.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
