package com.cachering.client.error;

/**
 * The node answered with an error, or the connection broke mid-operation.
 */
public class OperationFailedException extends CacheClientException {

    public OperationFailedException(String message) {
        super(message);
    }

    public OperationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
