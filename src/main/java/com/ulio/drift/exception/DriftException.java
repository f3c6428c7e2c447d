package com.ulio.drift.exception;

public class DriftException extends Exception {
    public DriftException(String message) {
        super(message);
    }

    public DriftException(String message, Throwable cause) {
        super(message, cause);
    }
}
