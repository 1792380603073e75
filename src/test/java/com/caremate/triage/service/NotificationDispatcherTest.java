package com.caremate.triage.service;

import com.caremate.triage.config.ResilienceConfig;
import com.caremate.triage.exception.NotificationDeliveryException;
import com.caremate.triage.service.channel.NotificationChannel;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDispatcherTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private NotificationDispatcher dispatcher(NotificationChannel... channels) {
        return new NotificationDispatcher(Arrays.asList(channels), executor,
                ResilienceConfig.exponential("test-notify", 3, 1), clock);
    }

    @Test
    void lowPriorityUsesDashboardOnly() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        RecordingChannel push = new RecordingChannel(NotificationChannelType.PUSH);
        RecordingChannel sms = new RecordingChannel(NotificationChannelType.SMS);

        List<NotificationRecord> records = dispatcher(dashboard, push, sms)
                .dispatch(List.of("N001"), UrgencyLevel.LOW, "P001", "hello");

        assertEquals(1, records.size());
        assertEquals(EnumSet.of(NotificationChannelType.DASHBOARD), records.get(0).getChannels());
        assertEquals(List.of("N001"), dashboard.recipients());
        assertTrue(push.recipients().isEmpty());
        assertTrue(sms.recipients().isEmpty());
    }

    @Test
    void highAddsPushAndCriticalAddsSms() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        RecordingChannel push = new RecordingChannel(NotificationChannelType.PUSH);
        RecordingChannel sms = new RecordingChannel(NotificationChannelType.SMS);
        NotificationDispatcher dispatcher = dispatcher(dashboard, push, sms);

        assertEquals(EnumSet.of(NotificationChannelType.DASHBOARD, NotificationChannelType.PUSH),
                dispatcher.channelsFor(UrgencyLevel.HIGH));
        assertEquals(EnumSet.allOf(NotificationChannelType.class), dispatcher.channelsFor(UrgencyLevel.CRITICAL));
        assertEquals(EnumSet.of(NotificationChannelType.DASHBOARD), dispatcher.channelsFor(UrgencyLevel.MEDIUM));
    }

    @Test
    void unconfiguredRequiredChannelMarksRecordFailed() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        RecordingChannel sms = new RecordingChannel(NotificationChannelType.SMS);
        sms.configured = false;
        NotificationDispatcher dispatcher = dispatcher(dashboard, sms);

        assertEquals(EnumSet.allOf(NotificationChannelType.class), dispatcher.channelsFor(UrgencyLevel.CRITICAL));

        NotificationRecord record = dispatcher
                .dispatch(List.of("RAPID_RESPONSE"), UrgencyLevel.CRITICAL, "P001", "code blue").get(0);

        assertEquals(DeliveryStatus.FAILED, record.getDeliveryStatus());
        assertEquals(EnumSet.allOf(NotificationChannelType.class), record.getChannels());
        assertTrue(record.getFailureReason().contains("PUSH: not configured"));
        assertTrue(record.getFailureReason().contains("SMS: not configured"));
        assertEquals(List.of("RAPID_RESPONSE"), dashboard.recipients());
        assertTrue(sms.recipients().isEmpty());
    }

    @Test
    void failingRecipientDoesNotAffectOthers() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        dashboard.alwaysFailFor.add("D001");

        List<NotificationRecord> records = dispatcher(dashboard)
                .dispatch(List.of("N001", "D001", "RAPID_RESPONSE"), UrgencyLevel.MEDIUM, "P001", "alert");

        Map<String, NotificationRecord> byRecipient = records.stream()
                .collect(Collectors.toMap(NotificationRecord::getRecipientId, r -> r));
        assertEquals(3, byRecipient.size());
        assertEquals(DeliveryStatus.SENT, byRecipient.get("N001").getDeliveryStatus());
        assertEquals(DeliveryStatus.SENT, byRecipient.get("RAPID_RESPONSE").getDeliveryStatus());

        NotificationRecord failed = byRecipient.get("D001");
        assertEquals(DeliveryStatus.FAILED, failed.getDeliveryStatus());
        assertEquals(3, failed.getAttempts());
        assertNotNull(failed.getFailureReason());
        assertNull(byRecipient.get("N001").getFailureReason());
    }

    @Test
    void transientFailureIsRetried() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        dashboard.failuresBeforeSuccess = 2;

        List<NotificationRecord> records = dispatcher(dashboard)
                .dispatch(List.of("N001"), UrgencyLevel.LOW, "P001", "alert");

        assertEquals(DeliveryStatus.SENT, records.get(0).getDeliveryStatus());
        assertEquals(3, records.get(0).getAttempts());
    }

    @Test
    void failedPushStillReportsFailedWhenDashboardWorked() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);
        RecordingChannel push = new RecordingChannel(NotificationChannelType.PUSH);
        push.alwaysFailFor.add("N001");

        NotificationRecord record = dispatcher(dashboard, push)
                .dispatch(List.of("N001"), UrgencyLevel.HIGH, "P001", "alert").get(0);

        assertEquals(DeliveryStatus.FAILED, record.getDeliveryStatus());
        assertEquals(List.of("N001"), dashboard.recipients());
        assertTrue(record.getFailureReason().startsWith("PUSH"));
    }

    @Test
    void recipientsAreDedupedAndBlanksDropped() {
        RecordingChannel dashboard = new RecordingChannel(NotificationChannelType.DASHBOARD);

        List<NotificationRecord> records = dispatcher(dashboard)
                .dispatch(Arrays.asList("N001", " ", null, "N001", "D001"), UrgencyLevel.LOW, "P001", "alert");

        assertEquals(2, records.size());
        assertEquals(new HashSet<>(List.of("N001", "D001")), new HashSet<>(dashboard.recipients()));
    }

    @Test
    void noRecipientsMeansNoRecords() {
        assertTrue(dispatcher(new RecordingChannel(NotificationChannelType.DASHBOARD))
                .dispatch(Collections.emptyList(), UrgencyLevel.CRITICAL, "P001", "alert").isEmpty());
    }

    static final class RecordingChannel implements NotificationChannel {

        private final NotificationChannelType type;
        private final List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        private final Set<String> alwaysFailFor = ConcurrentHashMap.newKeySet();
        private final AtomicInteger calls = new AtomicInteger();
        volatile int failuresBeforeSuccess;
        volatile boolean configured = true;

        RecordingChannel(NotificationChannelType type) {
            this.type = type;
        }

        @Override
        public NotificationChannelType type() {
            return type;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public void deliver(String recipientId, String message, UrgencyLevel priority) {
            if (alwaysFailFor.contains(recipientId)) {
                throw new NotificationDeliveryException(type, recipientId, "unreachable");
            }
            if (calls.incrementAndGet() <= failuresBeforeSuccess) {
                throw new NotificationDeliveryException(type, recipientId, "temporarily unavailable");
            }
            delivered.add(recipientId);
        }

        List<String> recipients() {
            synchronized (delivered) {
                return new ArrayList<>(delivered);
            }
        }
    }
}
