package com.carelog.core.error;

import java.util.UUID;

public class ConcernNotFoundException extends CareLogException {

    public ConcernNotFoundException(UUID concernId) {
        super(FailureKind.NOT_FOUND, "Concern not found: " + concernId);
    }
}
