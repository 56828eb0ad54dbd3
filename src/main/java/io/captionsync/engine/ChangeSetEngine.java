package io.captionsync.engine;

import io.captionsync.model.ChangeSet;
import io.captionsync.model.InstanceId;
import io.captionsync.model.QueryResult;
import io.captionsync.model.VersionInfo;

import java.util.List;

/**
 * Embedded replica with change tracking and a version clock.
 * <p>
 * Every successful local mutation that produces at least one change record advances the version by one.
 * Remote change sets are merged per column with last-writer-wins; merging is idempotent and order-insensitive.
 */
public interface ChangeSetEngine extends AutoCloseable {

    InstanceId instanceId();

    /**
     * Runs a read-only statement. Never changes the version.
     */
    QueryResult query(String sql, List<?> params);

    /**
     * Runs one mutating statement and returns the number of affected rows.
     */
    int exec(String sql, List<?> params);

    VersionInfo getVersionInfo();

    /**
     * Returns every tracked change with a local version greater than {@code version}, oldest first.
     */
    ChangeSet getChangesSince(long version);

    /**
     * Merges remote changes and returns the resulting local version.
     */
    long applyChanges(ChangeSet changes);

    /**
     * Raises the version floor to a version confirmed by the server.
     */
    void observeVersion(long version);

    /**
     * Replicated tables present in this image.
     */
    List<String> replicatedTables();

    /**
     * Serializes the current state (tracking tables included) to a standalone image.
     */
    byte[] exportImage();

    @Override
    void close();
}
