package com.caremate.triage.triage;

import com.caremate.triage.utils.DistressLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.UrgencyLevel;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of classifying one request. Keyword sets are sorted so that two classifications
 * of the same input compare equal.
 */
public final class Classification {

    private final IntentCategory intentCategory;
    private final UrgencyLevel urgencyLevel;
    private final DistressLevel distressLevel;
    private final Set<String> matchedKeywords;
    private final List<String> distressIndicators;
    private final double confidence;

    public Classification(IntentCategory intentCategory,
                          UrgencyLevel urgencyLevel,
                          DistressLevel distressLevel,
                          Set<String> matchedKeywords,
                          List<String> distressIndicators,
                          double confidence) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        this.intentCategory = Objects.requireNonNull(intentCategory, "intentCategory");
        this.urgencyLevel = Objects.requireNonNull(urgencyLevel, "urgencyLevel");
        this.distressLevel = Objects.requireNonNull(distressLevel, "distressLevel");
        this.matchedKeywords = matchedKeywords != null
                ? Collections.unmodifiableSet(new TreeSet<>(matchedKeywords))
                : Collections.emptySet();
        this.distressIndicators = distressIndicators != null
                ? List.copyOf(distressIndicators)
                : List.of();
        this.confidence = confidence;
    }

    public IntentCategory getIntentCategory() {
        return intentCategory;
    }

    public UrgencyLevel getUrgencyLevel() {
        return urgencyLevel;
    }

    public DistressLevel getDistressLevel() {
        return distressLevel;
    }

    public Set<String> getMatchedKeywords() {
        return matchedKeywords;
    }

    public List<String> getDistressIndicators() {
        return distressIndicators;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isEmergency() {
        return intentCategory == IntentCategory.EMERGENCY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Classification)) return false;
        Classification that = (Classification) o;
        return Double.compare(that.confidence, confidence) == 0
                && intentCategory == that.intentCategory
                && urgencyLevel == that.urgencyLevel
                && distressLevel == that.distressLevel
                && matchedKeywords.equals(that.matchedKeywords)
                && distressIndicators.equals(that.distressIndicators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(intentCategory, urgencyLevel, distressLevel, matchedKeywords, distressIndicators, confidence);
    }

    @Override
    public String toString() {
        return "Classification{" + intentCategory + ", urgency=" + urgencyLevel + ", distress=" + distressLevel
                + ", keywords=" + matchedKeywords + ", confidence=" + confidence + "}";
    }
}
