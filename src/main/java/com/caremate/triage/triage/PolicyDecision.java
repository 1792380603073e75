package com.caremate.triage.triage;

import com.caremate.triage.utils.EscalationLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of policy evaluation. Exactly one per request.
 */
public final class PolicyDecision {

    public static final String EMERGENCY_PROTOCOL = "EMERGENCY_PROTOCOL";
    public static final String MEDICAL_REQUEST_APPROVAL_REQUIRED = "MEDICAL_REQUEST_APPROVAL_REQUIRED";
    public static final String HIGH_URGENCY_DOCTOR_NOTIFICATION = "HIGH_URGENCY_DOCTOR_NOTIFICATION";
    public static final String MEDICATION_REQUEST_NURSE_REQUIRED = "MEDICATION_REQUEST_NURSE_REQUIRED";
    public static final String DISTRESS_ESCALATION = "DISTRESS_ESCALATION";
    public static final String NON_MEDICAL_AUTO_RESPONSE = "NON_MEDICAL_AUTO_RESPONSE";

    private final boolean requiresApproval;
    private final EscalationLevel escalationLevel;
    private final List<String> applicablePolicies;
    private final String reasoning;
    private final int estimatedResponseSeconds;

    public PolicyDecision(boolean requiresApproval,
                          EscalationLevel escalationLevel,
                          List<String> applicablePolicies,
                          String reasoning,
                          int estimatedResponseSeconds) {
        this.requiresApproval = requiresApproval;
        this.escalationLevel = Objects.requireNonNull(escalationLevel, "escalationLevel");
        this.applicablePolicies = applicablePolicies != null ? List.copyOf(applicablePolicies) : List.of();
        this.reasoning = reasoning != null ? reasoning : "";
        this.estimatedResponseSeconds = estimatedResponseSeconds;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    public EscalationLevel getEscalationLevel() {
        return escalationLevel;
    }

    public List<String> getApplicablePolicies() {
        return applicablePolicies;
    }

    public String getReasoning() {
        return reasoning;
    }

    public int getEstimatedResponseSeconds() {
        return estimatedResponseSeconds;
    }

    public boolean hasPolicy(String policy) {
        return applicablePolicies.contains(policy);
    }

    public boolean isMedicationRequest() {
        return hasPolicy(MEDICATION_REQUEST_NURSE_REQUIRED);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PolicyDecision{approval=" + requiresApproval + ", escalation=" + escalationLevel
                + ", policies=" + applicablePolicies + ", eta=" + estimatedResponseSeconds + "s}";
    }

    /**
     * Accumulates triggered rules. The escalation level only ever goes up; once
     * {@link #lockEscalation()} is called no later rule may change level, estimate or approval.
     */
    public static final class Builder {

        private static final int DEFAULT_ESTIMATE_SECONDS = 60;

        private boolean requiresApproval;
        private EscalationLevel escalationLevel = EscalationLevel.NONE;
        private int estimatedResponseSeconds = DEFAULT_ESTIMATE_SECONDS;
        private boolean escalationLocked;
        private final List<String> policies = new ArrayList<>();
        private final List<String> reasons = new ArrayList<>();

        private Builder() {
        }

        public Builder escalate(EscalationLevel level, int estimateSeconds) {
            if (escalationLocked) {
                return this;
            }
            if (level.isHigherThan(escalationLevel)) {
                escalationLevel = level;
                estimatedResponseSeconds = estimateSeconds;
            } else if (level == escalationLevel) {
                estimatedResponseSeconds = estimateSeconds;
            }
            return this;
        }

        public Builder requiresApproval(boolean requiresApproval) {
            if (!escalationLocked) {
                this.requiresApproval = requiresApproval;
            }
            return this;
        }

        public Builder estimate(int seconds) {
            if (!escalationLocked) {
                this.estimatedResponseSeconds = seconds;
            }
            return this;
        }

        public Builder lockEscalation() {
            this.escalationLocked = true;
            return this;
        }

        public Builder triggered(String policy, String reason) {
            policies.add(policy);
            reasons.add(reason);
            return this;
        }

        public boolean isEscalationLocked() {
            return escalationLocked;
        }

        public EscalationLevel currentLevel() {
            return escalationLevel;
        }

        public PolicyDecision build() {
            String reasoning = reasons.isEmpty() ? "Standard processing" : String.join(". ", reasons);
            return new PolicyDecision(requiresApproval, escalationLevel, policies, reasoning, estimatedResponseSeconds);
        }
    }
}
