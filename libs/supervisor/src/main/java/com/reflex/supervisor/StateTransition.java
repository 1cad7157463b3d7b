package com.reflex.supervisor;

import java.time.Instant;

/**
 * One state change of the supervised session.
 *
 * @param from state before the change
 * @param to state after the change (may equal {@code from} for a repeated reconnect failure)
 * @param cause what triggered it
 * @param at when it happened
 */
public record StateTransition(SessionState from, SessionState to, String cause, Instant at) {}
