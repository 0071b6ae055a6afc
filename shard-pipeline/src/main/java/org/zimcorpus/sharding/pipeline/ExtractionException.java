package org.zimcorpus.sharding.pipeline;

/**
 * Base class of the errors that end an extraction run. None of them are retried.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
