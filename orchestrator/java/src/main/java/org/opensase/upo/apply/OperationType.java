package org.opensase.upo.apply;

/** Kind of mutation a plan operation performs. */
public enum OperationType {
    ADD,
    MODIFY,
    REMOVE
}
