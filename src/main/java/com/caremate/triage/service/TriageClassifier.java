package com.caremate.triage.service;

import com.caremate.triage.triage.Classification;
import com.caremate.triage.utils.DistressLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.KeywordSet;
import com.caremate.triage.utils.TextNormalizer;
import com.caremate.triage.utils.UrgencyLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Keyword classifier for bedside requests. Pure: the result depends only on the text and history passed in.
 * <p>
 * Intent precedence is emergency, medical, non-medical, then a MEDICAL fallback so that
 * nothing unrecognised is treated as the lowest-risk category. Distress is scored separately.
 */
@Service
public class TriageClassifier {

    static final double EMERGENCY_CONFIDENCE = 0.99;
    static final double MEDICAL_CONFIDENCE = 0.85;
    static final double NON_MEDICAL_CONFIDENCE = 0.90;
    static final double FALLBACK_CONFIDENCE = 0.60;

    /** Only the most recent entries count towards repeated-request detection. */
    static final int HISTORY_WINDOW = 3;
    static final int MIN_HISTORY_FOR_REPEAT = 2;

    static final String REPEATED_REQUEST = "repeated_request";

    private static final KeywordSet EMERGENCY = KeywordSet.of(
            "chest pain", "can't breathe", "can not breathe", "cannot breathe", "not breathing",
            "severe bleeding", "unconscious", "heart attack", "heart pain", "stroke",
            "choking", "severe pain", "dying", "fainted", "emergency help");

    private static final KeywordSet MEDICAL = KeywordSet.of(
            "pain", "hurt", "medication", "medicine", "pill", "doctor", "nurse",
            "sick", "nausea", "dizzy", "fever", "symptom", "treatment",
            "injection", "iv", "blood pressure");

    private static final KeywordSet NON_MEDICAL = KeywordSet.of(
            "water", "temperature", "tv", "television", "light", "blanket",
            "pillow", "room", "visitor", "family", "time", "date", "weather",
            "bathroom", "toilet", "window", "curtain", "hot", "cold");

    private static final KeywordSet HIGH_URGENCY = KeywordSet.of(
            "help urgently", "dizzy", "fall down", "fell", "extreme pain", "panic", "scared");

    private static final KeywordSet HIGH_DISTRESS = KeywordSet.of(
            "help", "please help", "emergency", "urgent", "severe",
            "unbearable", "can't take it", "worse", "getting worse");

    private static final KeywordSet MEDIUM_DISTRESS = KeywordSet.of(
            "uncomfortable", "need", "please", "soon", "waiting",
            "still", "again", "repeatedly");

    public Classification classify(String text, List<String> recentHistory) {
        String t = TextNormalizer.normalize(text);

        IntentCategory intent;
        double confidence;
        List<String> matched;

        List<String> emergency = EMERGENCY.matches(t);
        List<String> medical = emergency.isEmpty() ? MEDICAL.matches(t) : Collections.emptyList();
        List<String> nonMedical = emergency.isEmpty() && medical.isEmpty()
                ? NON_MEDICAL.matches(t)
                : Collections.emptyList();

        if (!emergency.isEmpty()) {
            intent = IntentCategory.EMERGENCY;
            confidence = EMERGENCY_CONFIDENCE;
            matched = emergency;
        } else if (!medical.isEmpty()) {
            intent = IntentCategory.MEDICAL;
            confidence = MEDICAL_CONFIDENCE;
            matched = medical;
        } else if (!nonMedical.isEmpty()) {
            intent = IntentCategory.NON_MEDICAL;
            confidence = NON_MEDICAL_CONFIDENCE;
            matched = nonMedical;
        } else {
            intent = IntentCategory.MEDICAL;
            confidence = FALLBACK_CONFIDENCE;
            matched = Collections.emptyList();
        }

        UrgencyLevel urgency = urgencyFor(intent, t);

        List<String> indicators = new ArrayList<>();
        DistressLevel distress = distressFor(t, recentHistory, indicators);

        return new Classification(intent, urgency, distress, new LinkedHashSet<>(matched), indicators, confidence);
    }

    /**
     * The classification used when no classification could be produced in time.
     */
    public static Classification failSafe() {
        return new Classification(IntentCategory.MEDICAL, UrgencyLevel.MEDIUM, DistressLevel.NONE,
                Collections.emptySet(), Collections.emptyList(), FALLBACK_CONFIDENCE);
    }

    private static UrgencyLevel urgencyFor(IntentCategory intent, String t) {
        if (intent == IntentCategory.EMERGENCY) return UrgencyLevel.CRITICAL;
        if (HIGH_URGENCY.anyMatch(t)) return UrgencyLevel.HIGH;
        return intent == IntentCategory.NON_MEDICAL ? UrgencyLevel.LOW : UrgencyLevel.MEDIUM;
    }

    private static DistressLevel distressFor(String t, List<String> history, List<String> indicators) {
        List<String> high = HIGH_DISTRESS.matches(t);
        if (!high.isEmpty()) {
            indicators.addAll(high);
            return DistressLevel.HIGH;
        }
        if (isRepeatedRequest(t, history)) {
            indicators.add(REPEATED_REQUEST);
            return DistressLevel.MEDIUM;
        }
        List<String> medium = MEDIUM_DISTRESS.matches(t);
        if (!medium.isEmpty()) {
            indicators.addAll(medium);
            return DistressLevel.LOW;
        }
        return DistressLevel.NONE;
    }

    static boolean isRepeatedRequest(String t, List<String> history) {
        if (t.isEmpty() || history == null || history.size() < MIN_HISTORY_FOR_REPEAT) return false;
        int from = Math.max(0, history.size() - HISTORY_WINDOW);
        for (String previous : history.subList(from, history.size())) {
            String topic = TextNormalizer.normalize(previous);
            if (topic.isEmpty()) continue;
            if (topic.contains(t) || t.contains(topic)) {
                return true;
            }
        }
        return false;
    }
}
