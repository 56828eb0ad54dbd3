package io.captionsync.lock;

import com.fasterxml.jackson.databind.JsonNode;
import io.captionsync.error.ErrorCode;
import io.captionsync.error.LockException;
import io.captionsync.model.InstanceId;
import io.captionsync.model.LockState;
import io.captionsync.model.LockStatus;
import io.captionsync.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

public final class HttpLockService implements LockService {
    private final HttpClient http;
    private final String apiBaseUrl;
    private final String clientId;
    private final Duration timeout;

    public HttpLockService(HttpClient http, String apiBaseUrl, String clientId, Duration timeout) {
        this.http = http;
        this.apiBaseUrl = apiBaseUrl;
        this.clientId = clientId;
        this.timeout = timeout;
    }

    @Override
    public LockStatus acquire(InstanceId instanceId, String authToken) {
        HttpRequest request = request(instanceId, "/lock/acquire", authToken)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(Map.of("client_id", clientId)), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(instanceId, request, ErrorCode.LOCK_ACQUIRE_FAILED);
        if (response.statusCode() == 409) {
            LockStatus holder = parse(instanceId, response.body(), ErrorCode.LOCK_ACQUIRE_FAILED);
            return new LockStatus(holder.state() == LockState.RELEASED ? LockState.GRANTED : holder.state(), holder.holder(), false);
        }
        return expectOk(instanceId, response, ErrorCode.LOCK_ACQUIRE_FAILED);
    }

    @Override
    public LockStatus release(InstanceId instanceId, String authToken) {
        HttpRequest request = request(instanceId, "/lock/release", authToken)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> response = send(instanceId, request, ErrorCode.LOCK_RELEASE_FAILED);
        if (response.statusCode() == 404) {
            return LockStatus.released();
        }
        return expectOk(instanceId, response, ErrorCode.LOCK_RELEASE_FAILED);
    }

    @Override
    public LockStatus check(InstanceId instanceId, String authToken) {
        HttpRequest request = request(instanceId, "/lock", authToken).GET().build();
        HttpResponse<String> response = send(instanceId, request, ErrorCode.NETWORK_ERROR);
        return expectOk(instanceId, response, ErrorCode.NETWORK_ERROR);
    }

    URI lockUri(InstanceId instanceId, String suffix) {
        return URI.create(apiBaseUrl
                + "/videos/" + URLEncoder.encode(instanceId.videoId(), StandardCharsets.UTF_8)
                + "/databases/" + instanceId.databaseName().wireName()
                + suffix);
    }

    private HttpRequest.Builder request(InstanceId instanceId, String suffix, String authToken) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(lockUri(instanceId, suffix))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("X-Client-Id", clientId);
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        return builder;
    }

    private HttpResponse<String> send(InstanceId instanceId, HttpRequest request, ErrorCode failure) {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() == 401) {
                throw new LockException(ErrorCode.AUTH_REQUIRED, "Lock service rejected credentials for " + instanceId, instanceId, null);
            }
            return response;
        } catch (IOException e) {
            throw new LockException(failure, "Lock service unreachable for " + instanceId + ": " + e.getMessage(), instanceId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException(failure, "Interrupted while calling lock service for " + instanceId, instanceId, e);
        }
    }

    private LockStatus expectOk(InstanceId instanceId, HttpResponse<String> response, ErrorCode failure) {
        if (response.statusCode() / 100 != 2) {
            throw new LockException(failure, "Lock service returned HTTP " + response.statusCode() + " for " + instanceId, instanceId, null);
        }
        return parse(instanceId, response.body(), failure);
    }

    private LockStatus parse(InstanceId instanceId, String body, ErrorCode failure) {
        if (body == null || body.isBlank()) {
            return LockStatus.released();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            LockState state = LockState.fromString(node.path("state").asText(""));
            String holder = node.path("holder").isTextual() ? node.path("holder").asText() : null;
            return new LockStatus(state, holder, node.path("canEdit").asBoolean(false));
        } catch (IOException | IllegalArgumentException e) {
            throw new LockException(failure, "Malformed lock response for " + instanceId, instanceId, e);
        }
    }
}
