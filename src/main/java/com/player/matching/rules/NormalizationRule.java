package com.player.matching.rules;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied while normalizing player fields.
 *
 * <p>Rules run in ascending {@code priority}. A rule with no fields applies to every field;
 * patterns match case-insensitively, Unicode aware.</p>
 *
 * @param name        unique rule name, used for removal and in debug logs
 * @param pattern     compiled pattern
 * @param replacement replacement, may reference groups
 * @param fields      fields the rule is limited to, empty for all
 * @param priority    lower runs first
 */
public record NormalizationRule(
        String name,
        Pattern pattern,
        String replacement,
        Set<PlayerField> fields,
        int priority
) {
    private static final int DEFAULT_PRIORITY = 100;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        fields = fields == null || fields.isEmpty() ? Set.of() : Set.copyOf(fields);
    }

    public boolean isGlobal() {
        return fields.isEmpty();
    }

    /**
     * True if the rule runs for the given field. Global rules run for every field.
     */
    public boolean appliesTo(PlayerField field) {
        return isGlobal() || fields.contains(field);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private final Set<PlayerField> fields = EnumSet.noneOf(PlayerField.class);
        private int priority = DEFAULT_PRIORITY;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableFields(PlayerField... applicableFields) {
            fields.addAll(Set.of(applicableFields));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "pattern is required");
            Pattern compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return new NormalizationRule(name, compiled, replacement, fields, priority);
        }
    }
}
