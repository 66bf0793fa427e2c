package com.autosem.digital.process.optimizer.domain.exception;

public class ABTestNotFoundException extends RuntimeException {

    public ABTestNotFoundException(String testId) {
        super("A/B test not found: " + testId);
    }
}
