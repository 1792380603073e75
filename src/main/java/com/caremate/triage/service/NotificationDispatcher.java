package com.caremate.triage.service;

import com.caremate.triage.service.channel.NotificationChannel;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import io.github.resilience4j.retry.Retry;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Fans a staff alert out to every recipient concurrently. Each recipient is one task; within a task the
 * selected channels are tried in order, each under the notification retry policy. A failing recipient
 * never affects its siblings and never throws to the caller: it becomes a FAILED record. A channel the
 * priority requires but that has no configuration counts as a failed channel.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<NotificationChannelType, NotificationChannel> channels;
    private final Executor executor;
    private final Retry retry;
    private final Clock clock;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  @Qualifier("notificationExecutor") Executor executor,
                                  @Qualifier("notificationRetry") Retry retry,
                                  Clock clock) {
        this.channels = new EnumMap<>(NotificationChannelType.class);
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.type(), channel);
        }
        this.executor = executor;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * Delivers to all recipients and waits for every outcome.
     */
    public List<NotificationRecord> dispatch(PolicyDecision decision, Collection<String> recipients,
                                             UrgencyLevel priority, String patientId, String message) {
        return start(decision, recipients, priority, patientId, message).stream()
                .map(PendingDelivery::join)
                .collect(Collectors.toList());
    }

    public List<NotificationRecord> dispatch(Collection<String> recipients, UrgencyLevel priority,
                                             String patientId, String message) {
        return dispatch(null, recipients, priority, patientId, message);
    }

    /**
     * Starts one delivery task per distinct, non-blank recipient and returns without waiting.
     */
    public List<PendingDelivery> start(PolicyDecision decision, Collection<String> recipients,
                                       UrgencyLevel priority, String patientId, String message) {
        Set<NotificationChannelType> selected = channelsFor(priority);
        Set<String> targets = distinctRecipients(recipients);
        log.info("[{}] Dispatching {} alert to {} via {}{}", patientId, priority, targets, selected,
                decision != null ? " for " + decision.getApplicablePolicies() : "");

        List<PendingDelivery> pending = new ArrayList<>(targets.size());
        for (String recipientId : targets) {
            CompletableFuture<NotificationRecord> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> deliver(recipientId, selected, priority, message), executor)
                        .exceptionally(ex -> NotificationRecord.failed(recipientId, selected, priority,
                                clock.instant(), 0, String.valueOf(ex.getMessage())));
            } catch (RejectedExecutionException e) {
                log.error("[{}] Notification pool saturated, alert to {} not sent", patientId, recipientId);
                future = CompletableFuture.completedFuture(NotificationRecord.failed(recipientId, selected,
                        priority, clock.instant(), 0, "notification executor rejected the task"));
            }
            pending.add(new PendingDelivery(recipientId, selected, priority, future));
        }
        return pending;
    }

    /**
     * Dashboard always; push from HIGH; SMS only for CRITICAL. The set is what the priority requires, whether
     * or not every channel is configured.
     */
    Set<NotificationChannelType> channelsFor(UrgencyLevel priority) {
        Set<NotificationChannelType> wanted = EnumSet.of(NotificationChannelType.DASHBOARD);
        if (priority.isAtLeast(UrgencyLevel.HIGH)) {
            wanted.add(NotificationChannelType.PUSH);
        }
        if (priority == UrgencyLevel.CRITICAL) {
            wanted.add(NotificationChannelType.SMS);
        }
        return wanted;
    }

    private NotificationRecord deliver(String recipientId, Set<NotificationChannelType> selected,
                                       UrgencyLevel priority, String message) {
        int attempts = 0;
        List<String> failures = new ArrayList<>();
        for (NotificationChannelType type : selected) {
            NotificationChannel channel = channels.get(type);
            if (channel == null || !channel.isConfigured()) {
                log.warn("{} required for {} alert to {} but not configured", type, priority, recipientId);
                failures.add(type + ": not configured");
                continue;
            }
            AtomicInteger tries = new AtomicInteger();
            Runnable delivery = Retry.decorateRunnable(retry, () -> {
                tries.incrementAndGet();
                channel.deliver(recipientId, message, priority);
            });
            try {
                delivery.run();
            } catch (RuntimeException e) {
                log.warn("{} delivery to {} failed after {} attempt(s): {}", type, recipientId, tries.get(),
                        e.getMessage());
                failures.add(type + ": " + e.getMessage());
            }
            attempts = Math.max(attempts, tries.get());
        }
        if (failures.isEmpty()) {
            return NotificationRecord.sent(recipientId, selected, priority, clock.instant(), attempts);
        }
        return NotificationRecord.failed(recipientId, selected, priority, clock.instant(), attempts,
                String.join("; ", failures));
    }

    private static Set<String> distinctRecipients(Collection<String> recipients) {
        if (recipients == null) {
            return Collections.emptySet();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String recipient : recipients) {
            if (StringUtils.isNotBlank(recipient)) {
                distinct.add(recipient.trim());
            }
        }
        return distinct;
    }

    /**
     * A delivery task that may still be running.
     */
    public static final class PendingDelivery {

        private final String recipientId;
        private final Set<NotificationChannelType> channels;
        private final UrgencyLevel priority;
        private final CompletableFuture<NotificationRecord> future;

        PendingDelivery(String recipientId, Set<NotificationChannelType> channels, UrgencyLevel priority,
                        CompletableFuture<NotificationRecord> future) {
            this.recipientId = recipientId;
            this.channels = channels;
            this.priority = priority;
            this.future = future;
        }

        public String getRecipientId() {
            return recipientId;
        }

        public CompletableFuture<NotificationRecord> getFuture() {
            return future;
        }

        public NotificationRecord join() {
            return future.join();
        }

        /** The outcome if the task finished, otherwise a RETRYING record stamped at {@code clock}. */
        public NotificationRecord outcomeOrInFlight(Clock clock) {
            if (future.isDone()) {
                return future.join();
            }
            return NotificationRecord.inFlight(recipientId, channels, priority, clock.instant());
        }
    }
}
