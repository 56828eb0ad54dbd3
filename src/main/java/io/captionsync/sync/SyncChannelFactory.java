package io.captionsync.sync;

import io.captionsync.model.InstanceId;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface SyncChannelFactory {

    CompletableFuture<SyncChannel> open(InstanceId instanceId, String authToken, SyncChannel.Listener listener);
}
