package io.captionsync.config;

import io.captionsync.support.TestImages;
import io.captionsync.util.Backoff;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class SyncSettingsTest {

    @Test
    void missingSettingsFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-settings-defaults-");
        try {
            SyncClientConfig config = SyncClientConfig.fromRoot(root.toString(), "Tab One");
            SyncSettings settings = SyncSettings.load(config);

            Assertions.assertEquals(SyncSettings.defaults(), settings);
            Assertions.assertEquals(SyncClientConfig.DEFAULT_DOWNLOAD_MAX_ATTEMPTS, settings.downloadMaxAttempts());
            Assertions.assertEquals("tab-one", config.clientId());
            Assertions.assertEquals(root.toAbsolutePath().normalize().resolve("events").resolve("sync-events.jsonl"),
                    config.eventLogFile());
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void blankClientIdGetsGeneratedTabId() {
        SyncClientConfig first = SyncClientConfig.fromRoot("ignored", " ");
        SyncClientConfig second = SyncClientConfig.fromRoot("ignored", null);
        Assertions.assertTrue(first.clientId().startsWith("tab-"));
        Assertions.assertNotEquals(first.clientId(), second.clientId());
    }

    @Test
    void settingsFileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("captionsync-test-settings-file-");
        try {
            SyncClientConfig config = SyncClientConfig.fromRoot(root.toString(), "c1");
            Files.writeString(config.settingsFile(), """
                    {
                      "storageBaseUrl": "https://storage.example.com/bucket///",
                      "apiBaseUrl": "  ",
                      "downloadMaxAttempts": 0,
                      "downloadBaseDelayMs": 500,
                      "downloadMaxDelayMs": 100,
                      "backoffMultiplier": 0.5,
                      "reconnectAttemptCeiling": 4,
                      "initializeThreads": -3,
                      "someFutureKnob": true
                    }
                    """, StandardCharsets.UTF_8);

            SyncSettings settings = SyncSettings.load(config);

            Assertions.assertEquals("https://storage.example.com/bucket", settings.storageBaseUrl());
            Assertions.assertEquals(SyncClientConfig.DEFAULT_API_BASE_URL, settings.apiBaseUrl());
            Assertions.assertEquals(1, settings.downloadMaxAttempts());
            Assertions.assertEquals(500L, settings.downloadBaseDelayMs());
            Assertions.assertEquals(500L, settings.downloadMaxDelayMs());
            Assertions.assertEquals(1.0d, settings.backoffMultiplier());
            Assertions.assertEquals(4, settings.reconnectAttemptCeiling());
            Assertions.assertEquals(1, settings.initializeThreads());
            Assertions.assertEquals(SyncClientConfig.DEFAULT_HEARTBEAT_INTERVAL_MS, settings.heartbeatIntervalMs());
        } finally {
            TestImages.deleteRecursively(root);
        }
    }

    @Test
    void backoffGrowsAndCaps() {
        Backoff backoff = SyncSettings.defaults().downloadBackoff();
        Assertions.assertEquals(1_000L, backoff.delayForAttempt(0));
        Assertions.assertEquals(2_000L, backoff.delayForAttempt(1));
        Assertions.assertEquals(8_000L, backoff.delayForAttempt(3));
        Assertions.assertEquals(10_000L, backoff.delayForAttempt(4));
        Assertions.assertEquals(10_000L, backoff.delayForAttempt(500));
    }
}
