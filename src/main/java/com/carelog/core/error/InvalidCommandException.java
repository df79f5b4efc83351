package com.carelog.core.error;

public class InvalidCommandException extends CareLogException {

    public InvalidCommandException(String message) {
        super(FailureKind.INVALID_REQUEST, message);
    }
}
