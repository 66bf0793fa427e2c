package com.autosem.digital.process.optimizer.domain.exception;

public class InvalidABTestRequestException extends RuntimeException {

    public InvalidABTestRequestException(String message) {
        super(message);
    }
}
