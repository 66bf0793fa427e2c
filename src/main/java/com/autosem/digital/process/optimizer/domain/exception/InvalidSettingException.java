package com.autosem.digital.process.optimizer.domain.exception;

public class InvalidSettingException extends RuntimeException {

    public InvalidSettingException(String message) {
        super(message);
    }
}
