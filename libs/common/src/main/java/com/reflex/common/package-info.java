/**
 * Failure taxonomy shared by the supervisor, the event mesh and the view manager.
 *
 * <ul>
 *   <li>{@link com.reflex.common.ConnectionException}: store unreachable, generally retryable
 *   <li>{@link com.reflex.common.EventValidationException}: payload rejected by its schema
 *   <li>{@link com.reflex.common.ViewException}: a view went stale or does not exist
 * </ul>
 */
package com.reflex.common;
