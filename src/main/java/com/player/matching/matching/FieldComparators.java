package com.player.matching.matching;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.rules.NormalizedPlayer;
import com.player.matching.similarity.NameSimilarity;
import com.player.matching.similarity.NameSimilarityScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks over a normalized (event, reference) pair.
 *
 * <p>The name checks decide the match tier. The remaining checks are secondary: they are
 * only meaningful once a name-level match exists, and a side with missing data is never
 * reported as mismatched.</p>
 */
public class FieldComparators {

    private final NameSimilarityScorer nameScorer;

    public FieldComparators() {
        this(new NameSimilarityScorer());
    }

    public FieldComparators(NameSimilarityScorer nameScorer) {
        this.nameScorer = Objects.requireNonNull(nameScorer, "nameScorer is required");
    }

    // ============ Name checks ============

    public boolean isExactName(NormalizedPlayer event, NormalizedPlayer reference) {
        return event.lastName().equals(reference.lastName())
                && event.firstName().equals(reference.firstName());
    }

    /**
     * True if first and last name are swapped. A pair whose names are also equal in
     * place is classified as exact, never as a swap.
     */
    public boolean isNameSwap(NormalizedPlayer event, NormalizedPlayer reference) {
        return event.firstName().equals(reference.lastName())
                && event.lastName().equals(reference.firstName())
                && !isExactName(event, reference);
    }

    public NameSimilarity nameSimilarity(NormalizedPlayer event, NormalizedPlayer reference) {
        return nameScorer.score(event.lastName(), event.firstName(),
                reference.lastName(), reference.firstName());
    }

    /**
     * True if the combined name score reaches the threshold and neither the exact nor the
     * swap check holds.
     */
    public boolean isFuzzyName(NormalizedPlayer event, NormalizedPlayer reference, double fuzzyThreshold) {
        if (isExactName(event, reference) || isNameSwap(event, reference)) {
            return false;
        }
        return nameSimilarity(event, reference).combinedScore() >= fuzzyThreshold;
    }

    // ============ Secondary checks ============

    /**
     * True if day and month of birth are transposed. Needs all four values and a day
     * different from the month, otherwise the transposition would be invisible.
     */
    public boolean isDobMobSwap(NormalizedPlayer event, NormalizedPlayer reference) {
        Integer eventDay = event.dayOfBirth();
        Integer eventMonth = event.monthOfBirth();
        Integer refDay = reference.dayOfBirth();
        Integer refMonth = reference.monthOfBirth();
        if (eventDay == null || eventMonth == null || refDay == null || refMonth == null) {
            return false;
        }
        return eventDay.equals(refMonth)
                && eventMonth.equals(refDay)
                && !eventDay.equals(eventMonth);
    }

    public boolean isDayOfBirthMismatch(NormalizedPlayer event, NormalizedPlayer reference) {
        return differs(event.dayOfBirth(), reference.dayOfBirth());
    }

    public boolean isMonthOfBirthMismatch(NormalizedPlayer event, NormalizedPlayer reference) {
        return differs(event.monthOfBirth(), reference.monthOfBirth());
    }

    public boolean isSexMismatch(NormalizedPlayer event, NormalizedPlayer reference) {
        return differs(event.sex(), reference.sex());
    }

    public boolean isNationalityMismatch(NormalizedPlayer event, NormalizedPlayer reference) {
        return differs(event.association(), reference.association());
    }

    public boolean isBirthYearMismatch(NormalizedPlayer event, NormalizedPlayer reference) {
        return differs(event.yearOfBirth(), reference.yearOfBirth());
    }

    /**
     * Runs all secondary checks for a name-matched pair.
     *
     * @return detected issues in {@link MatchIssue} declaration order
     */
    public List<MatchIssue> detectIssues(NormalizedPlayer event, NormalizedPlayer reference) {
        List<MatchIssue> issues = new ArrayList<>();

        if (isDobMobSwap(event, reference)) {
            issues.add(MatchIssue.DOB_MOB_SWAP);
        } else {
            // Individual day/month differences only when the pair is not a transposition
            if (isDayOfBirthMismatch(event, reference)) {
                issues.add(MatchIssue.DOB_MISMATCH);
            }
            if (isMonthOfBirthMismatch(event, reference)) {
                issues.add(MatchIssue.MOB_MISMATCH);
            }
        }
        if (isSexMismatch(event, reference)) {
            issues.add(MatchIssue.SEX_MISMATCH);
        }
        if (isNationalityMismatch(event, reference)) {
            issues.add(MatchIssue.NATIONALITY_MISMATCH);
        }
        if (isBirthYearMismatch(event, reference)) {
            issues.add(MatchIssue.BIRTH_YEAR_MISMATCH);
        }
        return issues;
    }

    private static boolean differs(Integer a, Integer b) {
        return a != null && b != null && !a.equals(b);
    }

    private static boolean differs(String a, String b) {
        return !a.isEmpty() && !b.isEmpty() && !a.equals(b);
    }
}
