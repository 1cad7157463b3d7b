package com.reflex.mesh;

/** Who assigns sequence numbers. Fixed for the lifetime of an {@link EventMesh}. */
public enum SequenceMode {

    /** The mesh assigns the next sequence of the source on every publish. Publishing is not idempotent. */
    AUTO,

    /**
     * The producer supplies the sequence. Republishing an already stored {@code (source, sequence)}
     * returns the stored event without delivering it again.
     */
    CALLER
}
