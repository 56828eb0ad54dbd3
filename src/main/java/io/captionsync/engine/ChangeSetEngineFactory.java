package io.captionsync.engine;

import io.captionsync.model.InstanceId;

@FunctionalInterface
public interface ChangeSetEngineFactory {

    /**
     * Opens an engine over a copy of {@code image}.
     *
     * @throws io.captionsync.error.CorruptImageException when the bytes are not a readable SQLite database
     */
    ChangeSetEngine open(InstanceId instanceId, byte[] image);
}
