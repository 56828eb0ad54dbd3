package io.captionsync.engine;

import io.captionsync.model.InstanceId;

import java.nio.file.Path;

public final class SqliteEngineFactory implements ChangeSetEngineFactory {
    private final Path workDir;

    public SqliteEngineFactory(Path workDir) {
        this.workDir = workDir;
    }

    @Override
    public ChangeSetEngine open(InstanceId instanceId, byte[] image) {
        return SqliteChangeSetEngine.open(instanceId, image, workDir);
    }
}
