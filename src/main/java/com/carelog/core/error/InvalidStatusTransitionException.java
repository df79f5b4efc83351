package com.carelog.core.error;

import com.carelog.core.model.ConcernStatus;

import java.util.UUID;

public class InvalidStatusTransitionException extends CareLogException {

    public InvalidStatusTransitionException(UUID concernId, ConcernStatus from, ConcernStatus to) {
        super(FailureKind.INVALID_TRANSITION,
                "Concern " + concernId + " cannot move from " + from.dbValue() + " to " + to.dbValue());
    }
}
