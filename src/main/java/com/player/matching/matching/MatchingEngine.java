package com.player.matching.matching;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchOutcome;
import com.player.matching.core.model.MatchTier;
import com.player.matching.core.model.PlayerRecord;
import com.player.matching.rules.NormalizedPlayer;
import com.player.matching.rules.PlayerNormalizer;
import com.player.matching.similarity.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Selects the best reference record for one event record.
 *
 * <p>Tiers are strict: any exact match beats any name swap, which beats any fuzzy match.
 * Within exact and swap the first record in reference-set order wins. Within fuzzy the
 * highest combined score wins, ties going to the earlier record. The reference set is
 * only read.</p>
 */
public class MatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final PlayerNormalizer normalizer;
    private final FieldComparators comparators;

    public MatchingEngine() {
        this(new PlayerNormalizer(), new FieldComparators());
    }

    public MatchingEngine(PlayerNormalizer normalizer, FieldComparators comparators) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.comparators = Objects.requireNonNull(comparators, "comparators is required");
    }

    /**
     * Matches a raw event record against a raw reference set.
     */
    public MatchOutcome match(PlayerRecord event, List<PlayerRecord> referenceSet, double fuzzyThreshold) {
        return selectBest(event, normalizer.normalizeAll(referenceSet), fuzzyThreshold);
    }

    /**
     * Matches a raw event record against an already normalized reference set.
     * Callers matching many event records should normalize the reference set once.
     */
    public MatchOutcome matchNormalized(PlayerRecord event, List<NormalizedPlayer> referenceSet,
                                        double fuzzyThreshold) {
        return selectBest(event, referenceSet, fuzzyThreshold);
    }

    private MatchOutcome selectBest(PlayerRecord event, List<NormalizedPlayer> referenceSet, double fuzzyThreshold) {
        Objects.requireNonNull(event, "event is required");
        Objects.requireNonNull(referenceSet, "referenceSet is required");

        NormalizedPlayer normalizedEvent = normalizer.normalize(event);

        NormalizedPlayer swapCandidate = null;
        NormalizedPlayer fuzzyCandidate = null;
        double bestFuzzyScore = -1.0;

        for (NormalizedPlayer reference : referenceSet) {
            if (comparators.isExactName(normalizedEvent, reference)) {
                return outcome(normalizedEvent, reference, MatchTier.EXACT, 1.0);
            }
            if (swapCandidate != null) {
                // A swap is already known; only a later exact match can still win
                continue;
            }
            if (comparators.isNameSwap(normalizedEvent, reference)) {
                swapCandidate = reference;
                continue;
            }
            NameSimilarity similarity = comparators.nameSimilarity(normalizedEvent, reference);
            double score = similarity.combinedScore();
            if (score >= fuzzyThreshold && score > bestFuzzyScore) {
                bestFuzzyScore = score;
                fuzzyCandidate = reference;
            }
        }

        if (swapCandidate != null) {
            return outcome(normalizedEvent, swapCandidate, MatchTier.NAME_SWAP, 1.0);
        }
        if (fuzzyCandidate != null) {
            return outcome(normalizedEvent, fuzzyCandidate, MatchTier.FUZZY, bestFuzzyScore);
        }

        log.debug("match.none event='{}'", event.displayName());
        return MatchOutcome.noMatch(event);
    }

    private MatchOutcome outcome(NormalizedPlayer event, NormalizedPlayer reference,
                                 MatchTier tier, double similarity) {
        List<MatchIssue> issues = comparators.detectIssues(event, reference);
        log.debug("match.found tier={} event='{}' reference='{}' similarity={} issues={}",
                tier, event.source().displayName(), reference.source().displayName(), similarity, issues);
        return new MatchOutcome(event.source(), reference.source(), tier, similarity, issues);
    }
}
