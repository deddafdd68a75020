package com.player.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw field text into its comparable form.
 *
 * <p>Pipeline: compose to NFC, run the applicable rules by priority, fold case with
 * {@link Locale#ROOT}, collapse whitespace, trim, compose again. The result is stable
 * under a second pass, and diacritics survive.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\p{Z}]+");
    private static final Comparator<NormalizationRule> BY_PRIORITY =
            Comparator.comparingInt(NormalizationRule::priority);

    private final List<NormalizationRule> rules = new ArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> initialRules) {
        addRules(initialRules);
    }

    public void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        // stable sort keeps insertion order among equal priorities
        rules.sort(BY_PRIORITY);
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(rule -> rule.name().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes free text with the global rules only.
     */
    public String normalize(String value) {
        return normalize(value, null);
    }

    /**
     * Normalizes a field value. Never fails; {@code null} or blank input yields "".
     */
    public String normalize(String value, PlayerField field) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String composed = Normalizer.normalize(value, Normalizer.Form.NFC);
        String rewritten = applyRules(composed, field);
        String folded = WHITESPACE_RUN.matcher(rewritten.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        return Normalizer.normalize(folded, Normalizer.Form.NFC);
    }

    public boolean areEquivalent(String value1, String value2, PlayerField field) {
        return normalize(value1, field).equals(normalize(value2, field));
    }

    private String applyRules(String value, PlayerField field) {
        String current = value;
        for (NormalizationRule rule : rules) {
            boolean applicable = field == null ? rule.isGlobal() : rule.appliesTo(field);
            if (!applicable) {
                continue;
            }
            String next = rule.apply(current);
            if (log.isTraceEnabled() && !next.equals(current)) {
                log.trace("normalize.rule name={} before='{}' after='{}'", rule.name(), current, next);
            }
            current = next;
        }
        return current;
    }
}
