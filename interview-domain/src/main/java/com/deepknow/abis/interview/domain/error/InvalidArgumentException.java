package com.deepknow.abis.interview.domain.error;

public class InvalidArgumentException extends InterviewException {
    public InvalidArgumentException(String message) {
        super("INVALID_ARGUMENT", message);
    }
}
