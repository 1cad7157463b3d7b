package com.reflex.views;

/** Lifecycle of a materialized view. */
public enum ViewStatus {

    /** Folding events as they arrive. */
    ACTIVE,

    /** Replaying the event log; readers still see the previous state. */
    REBUILDING,

    /** Failed and no longer applying events until rebuilt. */
    STALE
}
