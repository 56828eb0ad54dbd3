package io.captionsync.sync;

/**
 * One open duplex connection for an instance. Implementations deliver inbound frames to their
 * {@link Listener} one at a time, in arrival order.
 */
public interface SyncChannel {

    void send(String frame);

    void close(int code, String reason);

    interface Listener {

        void onMessage(String frame);

        void onClosed(int code, String reason);

        void onFailure(Throwable error);
    }
}
