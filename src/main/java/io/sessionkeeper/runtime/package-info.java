/**
 * Wiring of the subsystem for one storage root.
 *
 * <p>{@link io.sessionkeeper.runtime.SessionKeeper} owns the session registry plus the stores
 * shared across sessions, and hands each session a
 * {@link io.sessionkeeper.runtime.SessionWorkspace} with its own event log, memory tiers and
 * task tracker. Nothing here is global: callers pass these objects to their agents explicitly.
 */
package io.sessionkeeper.runtime;
