package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.api.DeliveryRecord;
import io.github.drompincen.knowpipe.protocol.api.DeliveryReport;
import io.github.drompincen.knowpipe.protocol.api.DeliveryStatus;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import io.github.drompincen.knowpipe.runtime.config.DaemonThreads;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.NotificationDeliveryException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fire-and-forget fan-out of task events to subscribed channels. {@link #publish} only filters
 * and enqueues; each subscription delivers one event at a time, with a per-channel timeout and
 * retries scheduled on a timer so no pool thread waits on a channel. A slow or failing channel never blocks publishers or other
 * subscribers, and every outcome lands in the {@link DeliveryLog}.
 */
@Service
public class Notifier {

    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final Map<UUID, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final DeliveryLog deliveryLog;
    private final Clock clock;
    private final ProgressThrottle throttle;
    private final int mailboxCapacity;
    private final Duration channelTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final ExecutorService drainPool;
    private final ExecutorService callPool = Executors.newCachedThreadPool(DaemonThreads.named("notify-call"));
    private final ScheduledExecutorService timers =
            Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("notify-timer"));

    public Notifier(DeliveryLog deliveryLog, Clock clock, PipelineProperties properties) {
        this.deliveryLog = deliveryLog;
        this.clock = clock;
        PipelineProperties.Notify cfg = properties.getNotify();
        this.throttle = new ProgressThrottle(cfg.getProgressInterval());
        this.mailboxCapacity = cfg.getMailboxCapacity();
        this.channelTimeout = cfg.getChannelTimeout();
        this.maxRetries = Math.max(0, cfg.getMaxRetries());
        this.retryBackoff = cfg.getRetryBackoff();
        this.drainPool = Executors.newFixedThreadPool(Math.max(1, cfg.getPoolSize()), DaemonThreads.named("notify"));
    }

    public UUID subscribe(NotificationChannel channel, NotificationPreferences preferences) {
        Objects.requireNonNull(channel, "channel");
        UUID id = UUID.randomUUID();
        subscriptions.put(id, new Subscription(id, channel,
                preferences == null ? NotificationPreferences.all() : preferences, new Mailbox(mailboxCapacity)));
        log.info("[Notifier] Subscription {} on {} channel {}", id, channel.type(), channel.name());
        return id;
    }

    public boolean unsubscribe(UUID subscriptionId) {
        Subscription removed = subscriptions.remove(subscriptionId);
        if (removed != null) {
            log.info("[Notifier] Subscription {} removed", subscriptionId);
        }
        return removed != null;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    /** Never blocks on delivery and never throws for channel failures. */
    public DeliveryReport publish(NotificationEvent event) {
        Map<UUID, DeliveryStatus> outcomes = new LinkedHashMap<>();
        if (event.kind() == NotificationKind.PROGRESS && !throttle.tryAcquire(event.taskId(), clock.instant())) {
            subscriptions.keySet().forEach(id -> outcomes.put(id, DeliveryStatus.THROTTLED));
            log.debug("[Notifier] Progress for task {} throttled", event.taskId());
            return new DeliveryReport(event.taskId(), event.kind(), outcomes);
        }
        if (event.kind().isTerminal()) {
            throttle.forget(event.taskId());
        }
        for (Subscription sub : subscriptions.values()) {
            if (!sub.preferences.accepts(event)) {
                outcomes.put(sub.id, DeliveryStatus.FILTERED);
                continue;
            }
            Optional<NotificationEvent> dropped = sub.mailbox.offer(event);
            if (dropped.isPresent() && dropped.get() == event) {
                outcomes.put(sub.id, DeliveryStatus.DROPPED);
            } else {
                outcomes.put(sub.id, DeliveryStatus.QUEUED);
            }
            dropped.ifPresent(d -> {
                log.warn("[Notifier] Mailbox of {} full, dropped {} for task {}", sub.channel.name(), d.kind(), d.taskId());
                audit(sub, d, DeliveryStatus.DROPPED, 0, "mailbox full");
            });
            scheduleDrain(sub);
        }
        return new DeliveryReport(event.taskId(), event.kind(), outcomes);
    }

    public List<DeliveryRecord> deliveries(UUID taskId) {
        return deliveryLog.forTask(taskId);
    }

    /** Waits until every mailbox is empty and no drain is running. */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            boolean idle = subscriptions.values().stream()
                    .allMatch(s -> s.mailbox.isEmpty() && !s.draining.get());
            if (idle) return true;
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    @PreDestroy
    public void shutdown() {
        drainPool.shutdown();
        try {
            if (!drainPool.awaitTermination(channelTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                drainPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drainPool.shutdownNow();
        }
        timers.shutdownNow();
        callPool.shutdownNow();
    }

    private void scheduleDrain(Subscription sub) {
        if (!sub.draining.compareAndSet(false, true)) return;
        continueDrain(sub);
    }

    private void continueDrain(Subscription sub) {
        try {
            drainPool.execute(() -> drainNext(sub));
        } catch (RejectedExecutionException e) {
            sub.draining.set(false);
            log.warn("[Notifier] Could not schedule delivery for {}: {}", sub.channel.name(), e.getMessage());
        }
    }

    /** Starts the next delivery of this subscription; the drain stays claimed until its mailbox is empty. */
    private void drainNext(Subscription sub) {
        NotificationEvent event = sub.mailbox.poll();
        if (event != null) {
            attempt(sub, event, 1, null);
            return;
        }
        sub.draining.set(false);
        // an event may have arrived between the last poll and the flag reset
        if (!sub.mailbox.isEmpty() && subscriptions.containsKey(sub.id)) {
            scheduleDrain(sub);
        }
    }

    private void attempt(Subscription sub, NotificationEvent event, int attempt, String previousError) {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        Future<?> call;
        ScheduledFuture<?> timeout;
        try {
            call = callPool.submit(() -> {
                try {
                    sub.channel.deliver(event);
                    outcome.complete(null);
                } catch (Exception e) {
                    outcome.completeExceptionally(e);
                }
            });
            timeout = timers.schedule(() -> outcome.completeExceptionally(new NotificationDeliveryException(
                    "timed out after " + channelTimeout.toMillis() + " ms")), channelTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            audit(sub, event, DeliveryStatus.FAILED, attempt, previousError == null ? "notifier shut down" : previousError);
            sub.draining.set(false);
            return;
        }
        outcome.whenComplete((ok, failure) -> {
            timeout.cancel(false);
            if (failure == null) {
                audit(sub, event, DeliveryStatus.DELIVERED, attempt, null);
                continueDrain(sub);
                return;
            }
            call.cancel(true);
            String error = failure instanceof NotificationDeliveryException ? failure.getMessage() : String.valueOf(failure);
            log.warn("[Notifier] Delivery of {} for task {} to {} failed (attempt {}/{}): {}",
                    event.kind(), event.taskId(), sub.channel.name(), attempt, maxRetries + 1, error);
            if (attempt > maxRetries) {
                audit(sub, event, DeliveryStatus.FAILED, attempt, error);
                continueDrain(sub);
                return;
            }
            try {
                timers.schedule(() -> attempt(sub, event, attempt + 1, error),
                        retryBackoff.multipliedBy(1L << (attempt - 1)).toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                audit(sub, event, DeliveryStatus.FAILED, attempt, error);
                sub.draining.set(false);
            }
        });
    }

    /** Called when a task ends without a terminal event, so per-task state can be released. */
    public void forgetTask(UUID taskId) {
        throttle.forget(taskId);
    }

    public int throttledTaskCount() {
        return throttle.trackedTasks();
    }

    private void audit(Subscription sub, NotificationEvent event, DeliveryStatus status, int attempts, String error) {
        try {
            deliveryLog.record(new DeliveryRecord(event.taskId(), sub.channel.name(), sub.id, event.kind(), status,
                    attempts, error, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[Notifier] Could not record delivery for task {}: {}", event.taskId(), e.getMessage());
        }
    }

    private static final class Subscription {
        final UUID id;
        final NotificationChannel channel;
        final NotificationPreferences preferences;
        final Mailbox mailbox;
        final AtomicBoolean draining = new AtomicBoolean();

        Subscription(UUID id, NotificationChannel channel, NotificationPreferences preferences, Mailbox mailbox) {
            this.id = id;
            this.channel = channel;
            this.preferences = preferences;
            this.mailbox = mailbox;
        }
    }
}
