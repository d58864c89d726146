package com.chargelink.gateway.service;

import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.exception.ErrorCode;
import com.chargelink.gateway.model.DeviceResponse;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Pending Command Registry
 *
 * Matches unsolicited device replies to outstanding commands. Every command
 * carries its own deadline; a periodic sweep removes anything whose deadline
 * was missed. Callbacks always run on the callback executor, never on the
 * thread delivering the response.
 */
@Slf4j
@Service
public class PendingCommandRegistry {

    private final Map<String, PendingCommand> commands = new ConcurrentHashMap<>();
    private final Map<CorrelationKey, String> liveKeys = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutScheduler;
    private final Executor callbackExecutor;
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    public PendingCommandRegistry(@Qualifier("commandTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                                  @Qualifier("callbackExecutor") Executor callbackExecutor) {
        this.timeoutScheduler = timeoutScheduler;
        this.callbackExecutor = callbackExecutor;
    }

    /**
     * Track a command that is about to be sent. Never blocks.
     *
     * @throws ChargeGatewayException {@code DUPLICATE_COMMAND} if the key is still live,
     *                                {@code SHUTDOWN} once the registry is closing
     */
    public PendingCommand trackCommand(String deviceId, int command, int messageId, Duration timeout,
                                       BiConsumer<DeviceResponse, Throwable> callback) {
        if (shuttingDown.get()) {
            throw ChargeGatewayException.shutdown();
        }
        CorrelationKey key = new CorrelationKey(deviceId, command, messageId);
        PendingCommand pending = new PendingCommand(key, timeout, callback);

        String existing = liveKeys.putIfAbsent(key, pending.getId());
        if (existing != null) {
            log.warn("⚠️ Rejecting command {}: key still held by {}", key, existing);
            throw ChargeGatewayException.duplicateCommand(key.toString());
        }
        commands.put(pending.getId(), pending);
        pending.attachDeadline(timeoutScheduler.schedule(
                () -> expire(pending), timeout.toMillis(), TimeUnit.MILLISECONDS));

        log.debug("📝 Tracking {} (pending={})", pending, commands.size());
        return pending;
    }

    public PendingCommand trackCommand(String deviceId, int command, int messageId, Duration timeout) {
        return trackCommand(deviceId, command, messageId, timeout, null);
    }

    /**
     * Deliver a device reply to the command waiting for it.
     *
     * @return false if nothing was waiting (stale, duplicate or unexpected reply)
     */
    public boolean notifyResponse(String deviceId, int messageId, DeviceResponse response) {
        Optional<PendingCommand> match = commands.values().stream()
                .filter(pending -> pending.getKey().matches(deviceId, messageId))
                .filter(pending -> response == null || pending.getCommand() == response.getCommand())
                .findFirst();

        if (match.isEmpty()) {
            log.warn("⚠️ No pending command for device {} messageId 0x{}, dropping reply",
                    deviceId, Integer.toHexString(messageId));
            return false;
        }
        PendingCommand pending = match.get();
        boolean delivered = resolve(pending, response, null);
        if (delivered) {
            log.info("✅ Reply matched {} after {} ms", pending.getKey(),
                    Duration.between(pending.getCreatedAt(), Instant.now()).toMillis());
        } else {
            log.warn("⚠️ Duplicate reply for {} dropped", pending.getKey());
        }
        return delivered;
    }

    /**
     * Block until the command is answered or its deadline passes. On deadline the
     * command is removed and a {@code RESPONSE_TIMEOUT} error is thrown.
     */
    public DeviceResponse waitForResponse(PendingCommand pending) {
        try {
            return pending.getResult().get(pending.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            expire(pending);
            // The reply may have won the race against our own expiry
            return join(pending);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(pending);
            throw new CancellationException("Interrupted while waiting for " + pending.getKey());
        }
    }

    /**
     * Cancel a command explicitly. Waiters see a {@link CancellationException}.
     */
    public boolean cancel(PendingCommand pending) {
        boolean cancelled = resolve(pending, null, new CancellationException("Command cancelled: " + pending.getKey()));
        if (cancelled) {
            log.debug("🚫 Cancelled {}", pending);
        }
        return cancelled;
    }

    /**
     * Drop a command whose frame never left the process. No callback is invoked.
     */
    public void discard(PendingCommand pending, Throwable reason) {
        if (pending.markResolved()) {
            remove(pending);
            pending.getResult().completeExceptionally(reason);
            log.debug("🗑️ Discarded {}: {}", pending, reason.getMessage());
        }
    }

    public boolean isPending(String commandId) {
        return commands.containsKey(commandId);
    }

    public int pendingCount() {
        return commands.size();
    }

    public long pendingCount(String deviceId) {
        return commands.values().stream().filter(p -> p.getDeviceId().equals(deviceId)).count();
    }

    /**
     * Safety net for lost deadline wakeups.
     */
    @Scheduled(fixedRateString = "${charge-gateway.tracker.sweep-interval-ms:30000}")
    public int sweepExpired() {
        List<PendingCommand> expired = commands.values().stream().filter(PendingCommand::isExpired).toList();
        int swept = 0;
        for (PendingCommand pending : expired) {
            if (expire(pending)) {
                swept++;
            }
        }
        if (swept > 0) {
            log.warn("🧹 Sweep removed {} expired commands", swept);
        } else {
            log.debug("🧹 Sweep found nothing to remove (pending={})", commands.size());
        }
        return swept;
    }

    /**
     * Resolve every outstanding command with a shutdown error.
     */
    @PreDestroy
    public int shutdown() {
        shuttingDown.set(true);
        int resolved = 0;
        for (PendingCommand pending : List.copyOf(commands.values())) {
            if (resolve(pending, null, ChargeGatewayException.shutdown())) {
                resolved++;
            }
        }
        log.info("🛑 Command registry shut down, {} outstanding commands cancelled", resolved);
        return resolved;
    }

    // ==================== Internals ====================

    private boolean expire(PendingCommand pending) {
        boolean expired = resolve(pending, null, ChargeGatewayException.responseTimeout(
                pending.getDeviceId(), pending.getMessageId(), pending.getTimeout().toMillis()));
        if (expired) {
            log.warn("⏰ Command {} timed out after {} ms", pending.getKey(), pending.getTimeout().toMillis());
        }
        return expired;
    }

    private boolean resolve(PendingCommand pending, DeviceResponse response, Throwable error) {
        if (!pending.markResolved()) {
            return false;
        }
        remove(pending);

        if (error == null) {
            pending.getResult().complete(response);
        } else {
            pending.getResult().completeExceptionally(error);
        }

        BiConsumer<DeviceResponse, Throwable> callback = pending.getCallback();
        if (callback != null) {
            try {
                callbackExecutor.execute(() -> invokeCallback(pending, callback, response, error));
            } catch (RejectedExecutionException e) {
                log.warn("⚠️ Callback executor rejected callback for {}", pending.getKey());
            }
        }
        return true;
    }

    private void remove(PendingCommand pending) {
        commands.remove(pending.getId());
        liveKeys.remove(pending.getKey(), pending.getId());
        pending.cancelDeadline();
    }

    private void invokeCallback(PendingCommand pending, BiConsumer<DeviceResponse, Throwable> callback,
                                DeviceResponse response, Throwable error) {
        try {
            callback.accept(response, error);
        } catch (RuntimeException e) {
            log.error("❌ Callback for {} failed: {}", pending.getKey(), e.getMessage(), e);
        }
    }

    private DeviceResponse join(PendingCommand pending) {
        try {
            return pending.getResult().join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ChargeGatewayException(ErrorCode.SEND_FAILURE,
                "Unexpected command failure", cause != null ? cause.getMessage() : null, cause);
    }
}
