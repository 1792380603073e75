package com.caremate.triage.service;

import com.caremate.triage.triage.Classification;
import com.caremate.triage.utils.DistressLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.UrgencyLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriageClassifierTest {

    private final TriageClassifier classifier = new TriageClassifier();

    @Test
    void chestPainAndBreathingIsEmergency() {
        Classification c = classifier.classify("I'm having severe chest pain and I can't breathe", List.of());

        assertEquals(IntentCategory.EMERGENCY, c.getIntentCategory());
        assertEquals(UrgencyLevel.CRITICAL, c.getUrgencyLevel());
        assertEquals(0.99, c.getConfidence());
        assertTrue(c.getMatchedKeywords().contains("chest pain"));
        assertTrue(c.getMatchedKeywords().contains("can't breathe"));
    }

    @Test
    void emergencyWinsOverMedicalAndNonMedicalKeywords() {
        Classification c = classifier.classify("my room is cold and I think I'm having a heart attack, nurse!", List.of());

        assertEquals(IntentCategory.EMERGENCY, c.getIntentCategory());
        assertFalse(c.getMatchedKeywords().contains("room"));
        assertFalse(c.getMatchedKeywords().contains("nurse"));
    }

    @Test
    void medicalBeatsNonMedical() {
        Classification c = classifier.classify("Can I have some water with my pill?", List.of());

        assertEquals(IntentCategory.MEDICAL, c.getIntentCategory());
        assertEquals(UrgencyLevel.MEDIUM, c.getUrgencyLevel());
        assertEquals(0.85, c.getConfidence());
        assertTrue(c.getMatchedKeywords().contains("pill"));
    }

    @Test
    void waterIsNonMedicalAndLow() {
        Classification c = classifier.classify("Can I have some water?", List.of());

        assertEquals(IntentCategory.NON_MEDICAL, c.getIntentCategory());
        assertEquals(UrgencyLevel.LOW, c.getUrgencyLevel());
        assertEquals(DistressLevel.NONE, c.getDistressLevel());
        assertEquals(0.90, c.getConfidence());
    }

    @Test
    void dizzyMedicalRequestIsHighUrgency() {
        Classification c = classifier.classify("I feel dizzy", List.of());

        assertEquals(IntentCategory.MEDICAL, c.getIntentCategory());
        assertEquals(UrgencyLevel.HIGH, c.getUrgencyLevel());
    }

    @Test
    void unrecognisedTextFailsSafeToMedical() {
        Classification c = classifier.classify("hmm", List.of());

        assertEquals(IntentCategory.MEDICAL, c.getIntentCategory());
        assertEquals(UrgencyLevel.MEDIUM, c.getUrgencyLevel());
        assertEquals(0.60, c.getConfidence());
        assertTrue(c.getMatchedKeywords().isEmpty());
    }

    @Test
    void blankTextFailsSafeAndIsNeverARepeat() {
        Classification c = classifier.classify("   ", List.of("  ", "", " "));

        assertEquals(IntentCategory.MEDICAL, c.getIntentCategory());
        assertEquals(0.60, c.getConfidence());
        assertEquals(DistressLevel.NONE, c.getDistressLevel());
    }

    @Test
    void helpMeansHighDistress() {
        Classification c = classifier.classify("I really need help, I've been asking for assistance", List.of());

        assertEquals(IntentCategory.MEDICAL, c.getIntentCategory());
        assertEquals(DistressLevel.HIGH, c.getDistressLevel());
        assertTrue(c.getDistressIndicators().contains("help"));
    }

    @Test
    void repeatedRequestIsMediumDistress() {
        List<String> history = List.of("Can I get a blanket", "blanket");

        Classification c = classifier.classify("blanket", history);

        assertEquals(DistressLevel.MEDIUM, c.getDistressLevel());
        assertEquals(List.of(TriageClassifier.REPEATED_REQUEST), c.getDistressIndicators());
    }

    @Test
    void singleHistoryEntryIsNotEnoughForARepeat() {
        Classification c = classifier.classify("blanket", List.of("blanket"));

        assertEquals(DistressLevel.NONE, c.getDistressLevel());
    }

    @Test
    void onlyTheLastThreeHistoryEntriesCount() {
        List<String> history = List.of("blanket", "tv", "lights", "visitors");

        assertFalse(TriageClassifier.isRepeatedRequest("blanket", history));
        assertTrue(TriageClassifier.isRepeatedRequest("lights", history));
    }

    @Test
    void mediumDistressWordsGiveLowDistress() {
        Classification c = classifier.classify("I'm still waiting for my blanket", List.of());

        assertEquals(DistressLevel.LOW, c.getDistressLevel());
        assertTrue(c.getDistressIndicators().contains("waiting"));
        assertTrue(c.getDistressIndicators().contains("still"));
    }

    @Test
    void matchingIsCaseInsensitiveAndWholeWord() {
        assertEquals(IntentCategory.EMERGENCY, classifier.classify("CHEST PAIN", List.of()).getIntentCategory());
        // "painting" must not match "pain"
        assertEquals(IntentCategory.NON_MEDICAL,
                classifier.classify("there is a painting in my room", List.of()).getIntentCategory());
    }

    @Test
    void inflectedMedicalWordsStillClassify() {
        Classification hurting = classifier.classify("my leg is hurting", List.of());
        Classification painful = classifier.classify("my stomach is painful", List.of());

        assertEquals(IntentCategory.MEDICAL, hurting.getIntentCategory());
        assertEquals(0.85, hurting.getConfidence());
        assertEquals(IntentCategory.MEDICAL, painful.getIntentCategory());
        assertEquals(0.85, painful.getConfidence());
        assertEquals(DistressLevel.HIGH, classifier.classify("I feel so helpless", List.of()).getDistressLevel());
    }

    @Test
    void typographicApostropheStillMatches() {
        Classification c = classifier.classify("I can’t breathe", List.of());

        assertEquals(IntentCategory.EMERGENCY, c.getIntentCategory());
    }

    @Test
    void classifyIsDeterministic() {
        List<String> history = List.of("water please", "water");
        Classification first = classifier.classify("water please, I'm still waiting", history);
        Classification second = classifier.classify("water please, I'm still waiting", history);

        assertEquals(first, second);
    }
}
