package com.spectrace.tg.engine;

public enum MutationKind {
    RENAME_NODE,
    UPDATE_FIELD,
    ADD_REQUIREMENT,
    DELETE_REQUIREMENT,
    ADD_EDGE,
    CHANGE_EDGE_KIND,
    DELETE_EDGE,
    ADD_ASSERTION,
    DELETE_ASSERTION;

    public boolean isDestructive() {
        return this == DELETE_REQUIREMENT || this == DELETE_EDGE || this == DELETE_ASSERTION;
    }
}
