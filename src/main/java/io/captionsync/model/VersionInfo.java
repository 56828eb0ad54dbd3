package io.captionsync.model;

public record VersionInfo(long version, String siteId) {
}
