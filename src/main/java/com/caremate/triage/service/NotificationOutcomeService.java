package com.caremate.triage.service;

import com.caremate.triage.entity.NotificationOutcome;
import com.caremate.triage.repository.NotificationOutcomeRepository;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.utils.NotificationChannelType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class NotificationOutcomeService {

    private static final Logger log = LoggerFactory.getLogger(NotificationOutcomeService.class);

    private final NotificationOutcomeRepository repository;
    private final Clock clock;

    /** Stores the outcome a late delivery finally reached. */
    @Transactional
    public NotificationOutcome recordFinal(String requestId, String auditId, NotificationRecord record) {
        NotificationOutcome saved = repository.save(NotificationOutcome.builder()
                .notificationId(record.getId())
                .requestId(requestId)
                .auditId(auditId)
                .recipientId(record.getRecipientId())
                .channels(record.getChannels().stream()
                        .map(NotificationChannelType::name)
                        .collect(Collectors.joining(",")))
                .priority(record.getPriority())
                .deliveryStatus(record.getDeliveryStatus())
                .attempts(record.getAttempts())
                .failureReason(record.getFailureReason())
                .sentAt(record.getSentAt())
                .recordedAt(clock.instant())
                .build());
        log.info("[{}] Late alert to {} ended {} (audit {})", requestId, record.getRecipientId(),
                record.getDeliveryStatus(), auditId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<NotificationOutcome> listByAudit(String auditId) {
        return repository.findByAuditIdOrderByRecordedAtAsc(auditId);
    }
}
