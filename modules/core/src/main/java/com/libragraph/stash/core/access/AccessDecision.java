package com.libragraph.stash.core.access;

public enum AccessDecision {
    ALLOW,
    DENY;

    public boolean allowed() {
        return this == ALLOW;
    }
}
