package com.privacygraph.main.exception;

public class EngineNotReadyException extends RuntimeException {

    public EngineNotReadyException(String message) {
        super(message);
    }
}
