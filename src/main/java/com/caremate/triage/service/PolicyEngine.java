package com.caremate.triage.service;

import com.caremate.triage.triage.Classification;
import com.caremate.triage.triage.PolicyContext;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.DistressLevel;
import com.caremate.triage.utils.EscalationLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.KeywordSet;
import com.caremate.triage.utils.TextNormalizer;
import com.caremate.triage.utils.UrgencyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies hospital policy to a classification. Rules run in a fixed order and every rule that
 * fires is named in the decision, so an audit reader can replay why a request was routed.
 * <p>
 * Escalation never goes down. The emergency protocol is terminal: a medication keyword in the
 * same sentence neither lowers the level nor puts the request behind the approval gate.
 */
@Service
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    static final int EMERGENCY_ETA_SECONDS = 60;
    static final int NURSE_ETA_SECONDS = 300;
    static final int DOCTOR_ETA_SECONDS = 180;
    static final int DISTRESS_ETA_SECONDS = 180;
    static final int AUTO_RESPONSE_ETA_SECONDS = 5;

    private static final KeywordSet MEDICATION = KeywordSet.of(
            "medication", "medicine", "pill", "drug", "painkiller");

    public PolicyDecision evaluate(Classification classification, PolicyContext context) {
        PolicyDecision.Builder decision = PolicyDecision.builder();
        IntentCategory intent = classification.getIntentCategory();
        UrgencyLevel urgency = classification.getUrgencyLevel();

        if (intent == IntentCategory.EMERGENCY || urgency == UrgencyLevel.CRITICAL) {
            decision.requiresApproval(false)
                    .escalate(EscalationLevel.EMERGENCY, EMERGENCY_ETA_SECONDS)
                    .triggered(PolicyDecision.EMERGENCY_PROTOCOL,
                            "Emergency detected - immediate escalation to emergency staff")
                    .lockEscalation();
        } else if (intent == IntentCategory.MEDICAL) {
            decision.requiresApproval(true)
                    .escalate(EscalationLevel.NURSE, NURSE_ETA_SECONDS)
                    .triggered(PolicyDecision.MEDICAL_REQUEST_APPROVAL_REQUIRED,
                            "Medical request requires nurse approval before response");
            if (urgency.isAtLeast(UrgencyLevel.HIGH)) {
                decision.escalate(EscalationLevel.DOCTOR, DOCTOR_ETA_SECONDS)
                        .triggered(PolicyDecision.HIGH_URGENCY_DOCTOR_NOTIFICATION,
                                "High urgency medical request escalated to doctor");
            }
        }

        String text = TextNormalizer.normalize(context.getOriginalText());
        if (MEDICATION.anyMatch(text)) {
            if (decision.isEscalationLocked()) {
                log.warn("Medication keywords alongside an emergency; emergency protocol kept, approval gate bypassed");
            } else {
                decision.requiresApproval(true)
                        .escalate(EscalationLevel.NURSE, NURSE_ETA_SECONDS)
                        .triggered(PolicyDecision.MEDICATION_REQUEST_NURSE_REQUIRED,
                                "Medication-related request requires mandatory nurse approval");
            }
        }

        DistressLevel distress = classification.getDistressLevel();
        if ((distress == DistressLevel.MEDIUM || distress == DistressLevel.HIGH)
                && decision.currentLevel() == EscalationLevel.NONE) {
            decision.escalate(EscalationLevel.NURSE, DISTRESS_ETA_SECONDS)
                    .triggered(PolicyDecision.DISTRESS_ESCALATION,
                            "Patient showing " + distress + " distress - notifying nurse");
        }

        if (intent == IntentCategory.NON_MEDICAL && decision.currentLevel() == EscalationLevel.NONE) {
            decision.requiresApproval(false)
                    .estimate(AUTO_RESPONSE_ETA_SECONDS)
                    .triggered(PolicyDecision.NON_MEDICAL_AUTO_RESPONSE,
                            "Non-medical request approved for automatic response");
        }

        PolicyDecision result = decision.build();
        log.debug("Policy decision {} for {}", result, classification);
        return result;
    }
}
