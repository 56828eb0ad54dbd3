package io.captionsync.sync;

import io.captionsync.model.InstanceId;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public final class WebSocketSyncChannelFactory implements SyncChannelFactory {
    private final HttpClient http;
    private final String syncBaseUrl;
    private final String clientId;
    private final Duration connectTimeout;

    public WebSocketSyncChannelFactory(HttpClient http, String syncBaseUrl, String clientId, Duration connectTimeout) {
        this.http = http;
        this.syncBaseUrl = syncBaseUrl;
        this.clientId = clientId;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public CompletableFuture<SyncChannel> open(InstanceId instanceId, String authToken, SyncChannel.Listener listener) {
        WebSocket.Builder builder = http.newWebSocketBuilder().connectTimeout(connectTimeout);
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        return builder.buildAsync(syncUri(instanceId), new WebSocketSyncChannel.Adapter(listener))
                .<SyncChannel>thenApply(socket -> new WebSocketSyncChannel(socket, listener));
    }

    URI syncUri(InstanceId instanceId) {
        return URI.create(syncBaseUrl
                + "/videos/" + URLEncoder.encode(instanceId.videoId(), StandardCharsets.UTF_8)
                + "/databases/" + instanceId.databaseName().wireName()
                + "/sync?client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8));
    }
}
