package com.phillippitts.essaydefense.service.external;

/**
 * Signals a failure that another attempt cannot fix, such as a 4xx answer other than 404/429.
 * {@link BoundedCallExecutor} stops retrying when a call throws it.
 */
public class NonRetryableCallException extends RuntimeException {

    public NonRetryableCallException(String message) {
        super(message);
    }

    public NonRetryableCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
