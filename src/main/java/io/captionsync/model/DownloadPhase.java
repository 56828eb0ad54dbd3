package io.captionsync.model;

public enum DownloadPhase {
    DOWNLOADING,
    DECOMPRESSING,
    COMPLETE,
    ERROR
}
