package com.privacygraph.main.exception;

/**
 * The chat model produced no usable graph for a document. Nothing has been written when this is thrown.
 */
public class GraphExtractionException extends RuntimeException {

    public GraphExtractionException(String message) {
        super(message);
    }

    public GraphExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
