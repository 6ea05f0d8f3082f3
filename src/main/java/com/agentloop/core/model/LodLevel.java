package com.agentloop.core.model;

/**
 * Level of detail at which a context round is retained. Only ever moves forward.
 */
public enum LodLevel {
    RAW,
    COMPRESSED,
    ARCHIVED;

    public boolean canAdvanceTo(LodLevel next) {
        return next.ordinal() == ordinal() + 1;
    }
}
