/**
 * Instance lifecycle package.
 *
 * <p>{@link io.captionsync.registry.InstanceRegistry} initializes replicas (download, engine open, sync, lock),
 * gates mutations on the edit lock, applies inbound sync traffic and exposes subscriptions and snapshots.
 */
package io.captionsync.registry;
