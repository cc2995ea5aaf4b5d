package com.privacygraph.main.exception;

/**
 * A read against the graph storage failed. Mutations report failures through outcomes instead.
 */
public class GraphOperationException extends RuntimeException {

    public GraphOperationException(String message) {
        super(message);
    }

    public GraphOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
