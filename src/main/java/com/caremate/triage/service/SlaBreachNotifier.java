package com.caremate.triage.service;

import com.caremate.triage.component.ResponsePhrases;
import com.caremate.triage.component.StaffAssignment;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.triage.SlaBreachEvent;
import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.UrgencyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Escalates a breached approval to the patient's attending physician.
 */
@Component
public class SlaBreachNotifier {

    private static final Logger log = LoggerFactory.getLogger(SlaBreachNotifier.class);

    private final PatientContextProvider patientContextProvider;
    private final StaffAssignment staffAssignment;
    private final NotificationDispatcher dispatcher;
    private final ResponsePhrases phrases;

    public SlaBreachNotifier(PatientContextProvider patientContextProvider, StaffAssignment staffAssignment,
                             NotificationDispatcher dispatcher, ResponsePhrases phrases) {
        this.patientContextProvider = patientContextProvider;
        this.staffAssignment = staffAssignment;
        this.dispatcher = dispatcher;
        this.phrases = phrases;
    }

    @EventListener
    public void onBreach(SlaBreachEvent event) {
        String physician = staffAssignment.physicianFor(patientContextProvider.lookup(event.getPatientId()));
        UrgencyLevel priority = event.getPriority() == UrgencyLevel.CRITICAL ? UrgencyLevel.CRITICAL : UrgencyLevel.HIGH;
        String message = phrases.slaBreachAlert(event.getEntryId(), event.getPatientId(), event.getSlaMinutes());

        List<NotificationRecord> records = dispatcher.dispatch(List.of(physician), priority, event.getPatientId(), message);
        boolean failed = records.stream().anyMatch(r -> r.getDeliveryStatus() == DeliveryStatus.FAILED);
        if (failed) {
            log.error("SLA breach alert for approval {} could not reach {}", event.getEntryId(), physician);
        } else {
            log.info("SLA breach alert for approval {} sent to {}", event.getEntryId(), physician);
        }
    }
}
