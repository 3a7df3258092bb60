/**
 * SessionKeeper source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sessionkeeper.runtime.SessionKeeper} wires a storage root and opens session workspaces.</li>
 *   <li>{@code io.sessionkeeper.session.SessionRegistry} owns session identity, namespaces and retention.</li>
 *   <li>{@code io.sessionkeeper.memory.MemoryTierManager} serves the four memory tiers of a session.</li>
 *   <li>{@code io.sessionkeeper.observability.EventLog} records structured session events off the caller's thread.</li>
 *   <li>{@code io.sessionkeeper.cli.SessionKeeperCommand} is the operator CLI over a storage root.</li>
 * </ul>
 */
package io.sessionkeeper;
