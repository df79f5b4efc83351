package com.carelog.core.error;

/**
 * No active concern matched the name the user typed.
 */
public class ConcernNotMatchedException extends CareLogException {

    private final String target;

    public ConcernNotMatchedException(String target) {
        super(FailureKind.NO_MATCH, "Could not find a concern matching \"" + target + "\"");
        this.target = target;
    }

    public String target() {
        return target;
    }
}
