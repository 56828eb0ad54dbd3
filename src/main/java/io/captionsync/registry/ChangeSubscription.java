package io.captionsync.registry;

import io.captionsync.model.ChangeRecord;
import io.captionsync.model.InstanceId;
import io.captionsync.observability.SyncEventLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live registration for remote change records. With a debounce window, records arriving inside the
 * window are delivered together once it elapses.
 */
public final class ChangeSubscription implements AutoCloseable {
    private final InstanceId instanceId;
    private final SubscriptionFilter filter;
    private final long debounceMs;
    private final Consumer<List<ChangeRecord>> callback;
    private final ScheduledExecutorService scheduler;
    private final SyncEventLog eventLog;
    private final Consumer<ChangeSubscription> onClose;
    private final List<ChangeRecord> buffer = new ArrayList<>();
    private ScheduledFuture<?> flush;
    private volatile boolean active = true;

    ChangeSubscription(
            InstanceId instanceId,
            SubscriptionFilter filter,
            long debounceMs,
            Consumer<List<ChangeRecord>> callback,
            ScheduledExecutorService scheduler,
            SyncEventLog eventLog,
            Consumer<ChangeSubscription> onClose
    ) {
        this.instanceId = instanceId;
        this.filter = filter == null ? SubscriptionFilter.all() : filter;
        this.debounceMs = Math.max(0L, debounceMs);
        this.callback = callback;
        this.scheduler = scheduler;
        this.eventLog = eventLog;
        this.onClose = onClose;
    }

    public SubscriptionFilter filter() {
        return filter;
    }

    public boolean isActive() {
        return active;
    }

    void offer(List<ChangeRecord> records) {
        if (!active) {
            return;
        }
        List<ChangeRecord> matching = new ArrayList<>();
        for (ChangeRecord record : records) {
            if (filter.matches(record)) {
                matching.add(record);
            }
        }
        if (matching.isEmpty()) {
            return;
        }
        if (debounceMs == 0L) {
            deliver(matching);
            return;
        }
        synchronized (buffer) {
            buffer.addAll(matching);
            if (flush == null) {
                flush = scheduler.schedule(this::flush, debounceMs, TimeUnit.MILLISECONDS);
            }
        }
    }

    private void flush() {
        List<ChangeRecord> batch;
        synchronized (buffer) {
            batch = new ArrayList<>(buffer);
            buffer.clear();
            flush = null;
        }
        if (!batch.isEmpty() && active) {
            deliver(batch);
        }
    }

    private void deliver(List<ChangeRecord> records) {
        try {
            callback.accept(List.copyOf(records));
        } catch (RuntimeException e) {
            eventLog.log("subscription.callback_failed", instanceId, "contained",
                    Map.of("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    @Override
    public void close() {
        if (!active) {
            return;
        }
        active = false;
        synchronized (buffer) {
            if (flush != null) {
                flush.cancel(false);
                flush = null;
            }
            buffer.clear();
        }
        onClose.accept(this);
    }
}
