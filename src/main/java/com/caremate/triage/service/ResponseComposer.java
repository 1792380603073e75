package com.caremate.triage.service;

import com.caremate.triage.component.ResponsePhrases;
import com.caremate.triage.exception.PolicyInvariantViolationException;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.EscalationLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.KeywordSet;
import com.caremate.triage.utils.TextNormalizer;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Turns a policy decision into the sentence read back to the patient. Template lookup only.
 */
@Service
public class ResponseComposer {

    private final ResponsePhrases phrases;
    private final Clock clock;
    private final List<CannedReply> nonMedicalReplies;

    public ResponseComposer(ResponsePhrases phrases, Clock clock) {
        this.phrases = phrases;
        this.clock = clock;
        this.nonMedicalReplies = List.of(
                new CannedReply(KeywordSet.of("water"), phrases::water),
                new CannedReply(KeywordSet.of("temperature", "hot", "cold", "warm"), phrases::roomTemperature),
                new CannedReply(KeywordSet.of("tv", "television"), phrases::television),
                new CannedReply(KeywordSet.of("light"), phrases::lights),
                new CannedReply(KeywordSet.of("visitor", "family"), phrases::visitingHours),
                new CannedReply(KeywordSet.of("time"), () -> phrases.currentTime(LocalTime.now(clock))));
    }

    public String compose(PolicyDecision decision, IntentCategory intent, String originalText) {
        checkInvariants(decision, intent);

        EscalationLevel escalation = decision.getEscalationLevel();
        if (escalation == EscalationLevel.EMERGENCY) {
            return phrases.emergencyDispatched();
        }
        if (decision.isRequiresApproval()
                && (escalation == EscalationLevel.NURSE || escalation == EscalationLevel.DOCTOR)) {
            return phrases.staffNotified(escalation == EscalationLevel.NURSE ? "nurse" : "doctor");
        }
        if (intent == IntentCategory.NON_MEDICAL) {
            String t = TextNormalizer.normalize(originalText);
            for (CannedReply reply : nonMedicalReplies) {
                if (reply.keywords.anyMatch(t)) {
                    return reply.text.get();
                }
            }
            return phrases.requestNoted();
        }
        return phrases.coordinatingWithCareTeam();
    }

    static void checkInvariants(PolicyDecision decision, IntentCategory intent) {
        if (decision.getEscalationLevel() == EscalationLevel.EMERGENCY && decision.isRequiresApproval()) {
            throw new PolicyInvariantViolationException(
                    "EMERGENCY escalation must bypass approval: " + decision);
        }
        if (intent == IntentCategory.EMERGENCY && decision.getEscalationLevel() != EscalationLevel.EMERGENCY) {
            throw new PolicyInvariantViolationException(
                    "EMERGENCY intent routed to " + decision.getEscalationLevel() + ": " + decision);
        }
    }

    private static final class CannedReply {
        private final KeywordSet keywords;
        private final Supplier<String> text;

        private CannedReply(KeywordSet keywords, Supplier<String> text) {
            this.keywords = keywords;
            this.text = text;
        }
    }
}
