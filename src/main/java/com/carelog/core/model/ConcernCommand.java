package com.carelog.core.model;

import java.util.List;

/**
 * A user-issued concern management command as extracted by the upstream
 * intent parser. Target names are free text and still need fuzzy resolution.
 */
public record ConcernCommand(Type type, List<String> targets, String newName) {

    public enum Type {
        MERGE,
        DELETE,
        RENAME
    }

    public ConcernCommand {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static ConcernCommand merge(List<String> targets) {
        return new ConcernCommand(Type.MERGE, targets, null);
    }

    public static ConcernCommand delete(String target) {
        return new ConcernCommand(Type.DELETE, List.of(target), null);
    }

    public static ConcernCommand rename(String target, String newName) {
        return new ConcernCommand(Type.RENAME, List.of(target), newName);
    }
}
