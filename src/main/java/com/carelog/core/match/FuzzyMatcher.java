package com.carelog.core.match;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a free-text name to the closest candidate name.
 *
 * <h2>Scoring</h2>
 * Both sides are folded with {@link TextNormalizer}, then:
 * <ul>
 *   <li>equal after folding: {@code 1.0}</li>
 *   <li>one side appears inside the other on word boundaries: {@code 0.8..1.0},
 *       higher when the lengths are closer</li>
 *   <li>otherwise the overlap of significant words: shared / distinct</li>
 * </ul>
 * The best candidate is returned only when its score reaches the threshold.
 *
 * <h2>Ties</h2>
 * The first candidate with the top score wins. Callers pass candidates ordered
 * most recently updated first, so ties resolve to the most recent concern.
 */
public final class FuzzyMatcher {

    public static final double DEFAULT_THRESHOLD = 0.5;

    private static final double CONTAINMENT_FLOOR = 0.8;

    // Containment of very short fragments ("a", "of") is meaningless.
    private static final int MIN_CONTAINED_LENGTH = 3;

    private static final int MIN_SIGNIFICANT_WORD_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "de", "la", "el", "en", "y", "del", "a", "los", "las", "un", "una", "por",
            "the", "and", "in", "of", "an", "for", "with", "on", "at", "to", "my",
            "da", "do", "das", "dos", "no", "na", "em", "com", "para", "um", "uma",
            "le", "les", "des", "du", "au", "aux", "avec", "dans", "pour");

    private final double threshold;

    public FuzzyMatcher() {
        this(DEFAULT_THRESHOLD);
    }

    public FuzzyMatcher(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public Optional<String> match(String target, List<String> candidates) {
        return best(target, candidates, Function.identity());
    }

    /**
     * Returns the candidate whose name best matches {@code target}, or empty when
     * nothing clears the threshold. Never picks an arbitrary candidate.
     */
    public <T> Optional<T> best(String target, List<T> candidates, Function<T, String> nameOf) {
        String normalizedTarget = TextNormalizer.normalize(target);
        if (normalizedTarget.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        T best = null;
        double bestScore = 0.0;
        for (T candidate : candidates) {
            double s = score(normalizedTarget, TextNormalizer.normalize(nameOf.apply(candidate)));
            if (s > bestScore) {
                best = candidate;
                bestScore = s;
            }
        }
        return bestScore >= threshold ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * True when the two names would be treated as the same concern.
     */
    public boolean matches(String a, String b) {
        return score(TextNormalizer.normalize(a), TextNormalizer.normalize(b)) >= threshold;
    }

    /**
     * Scores two already-normalized names.
     */
    static double score(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }

        boolean aIsShorter = a.length() <= b.length();
        String shorter = aIsShorter ? a : b;
        String longer = aIsShorter ? b : a;
        if (shorter.length() >= MIN_CONTAINED_LENGTH && (" " + longer + " ").contains(" " + shorter + " ")) {
            double lengthRatio = (double) shorter.length() / longer.length();
            return CONTAINMENT_FLOOR + (1.0 - CONTAINMENT_FLOOR) * lengthRatio;
        }

        return wordOverlap(a, b);
    }

    private static double wordOverlap(String a, String b) {
        Set<String> wordsA = significantWords(a);
        Set<String> wordsB = significantWords(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(wordsA);
        union.addAll(wordsB);
        long shared = wordsA.stream().filter(wordsB::contains).count();
        return (double) shared / union.size();
    }

    private static Set<String> significantWords(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .filter(w -> w.length() >= MIN_SIGNIFICANT_WORD_LENGTH && !STOP_WORDS.contains(w))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
