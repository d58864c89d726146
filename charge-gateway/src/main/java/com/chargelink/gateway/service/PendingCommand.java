package com.chargelink.gateway.service;

import com.chargelink.gateway.model.DeviceResponse;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * One in-flight command awaiting its device reply.
 *
 * Owned by {@link PendingCommandRegistry} until resolved. Resolution (response,
 * timeout or cancel) happens at most once.
 */
@Getter
public class PendingCommand {

    private final String id;
    private final CorrelationKey key;
    private final Instant createdAt;
    private final Duration timeout;
    private final CompletableFuture<DeviceResponse> result = new CompletableFuture<>();
    private final BiConsumer<DeviceResponse, Throwable> callback;

    @Getter(AccessLevel.NONE)
    private final long deadlineNanos;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean resolved = new AtomicBoolean();
    @Getter(AccessLevel.PACKAGE)
    private volatile ScheduledFuture<?> deadline;

    PendingCommand(CorrelationKey key, Duration timeout, BiConsumer<DeviceResponse, Throwable> callback) {
        this.id = UUID.randomUUID().toString();
        this.key = key;
        this.createdAt = Instant.now();
        this.timeout = timeout;
        this.callback = callback;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    public String getDeviceId() {
        return key.deviceId();
    }

    public int getCommand() {
        return key.command();
    }

    public int getMessageId() {
        return key.messageId();
    }

    public boolean isResolved() {
        return resolved.get();
    }

    public long remainingMillis() {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    boolean isExpired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    // First caller wins
    boolean markResolved() {
        return resolved.compareAndSet(false, true);
    }

    void attachDeadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
        if (resolved.get()) {
            deadline.cancel(false);
        }
    }

    void cancelDeadline() {
        ScheduledFuture<?> current = deadline;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PendingCommand{id=" + id + ", key=" + key + ", timeout=" + timeout.toMillis() + "ms}";
    }
}
