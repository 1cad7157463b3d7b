package com.reflex.views;

/** What {@link MaterializedViewManager#apply} did with an event. */
public enum ApplyOutcome {

    /** Folded into the state, possibly together with buffered successors. */
    APPLIED,

    /** At or below the source's watermark, or already buffered. Nothing changed. */
    DUPLICATE,

    /** Ahead of the source's watermark; held until its predecessor arrives. */
    BUFFERED,

    /** The view is stale and ignores events until rebuilt. */
    IGNORED_STALE
}
