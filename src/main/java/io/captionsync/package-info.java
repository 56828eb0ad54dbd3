/**
 * captionsync source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.captionsync.Main} bootstraps the operator CLI.</li>
 *   <li>{@code io.captionsync.registry.InstanceRegistry} owns live replicas and is what applications talk to.</li>
 *   <li>{@code io.captionsync.engine.SqliteChangeSetEngine} tracks, extracts and merges changes.</li>
 *   <li>{@code io.captionsync.sync.SyncManager} keeps one replica in step with the server.</li>
 * </ul>
 */
package io.captionsync;
