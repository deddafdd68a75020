package com.player.matching.rules;

import java.util.List;

/**
 * Built-in rules for player fields.
 * Diacritics are kept: "Müller" and "Muller" remain different names.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getNameRules());
        return engine;
    }

    /**
     * Gets rules that apply to every field.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // BOM, zero-width space and other invisible format characters
                NormalizationRule.builder()
                        .name("common-format-chars")
                        .pattern("\\p{Cf}+")
                        .replacement("")
                        .priority(10)
                        .build(),

                // Any Unicode whitespace run, e.g. NBSP or U+2006
                NormalizationRule.builder()
                        .name("common-unicode-whitespace")
                        .pattern("[\\s\\p{Z}]+")
                        .replacement(" ")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Gets rules for last and first names.
     */
    public static List<NormalizationRule> getNameRules() {
        return List.of(
                // "Meyer - Schmidt" -> "Meyer-Schmidt"
                NormalizationRule.builder()
                        .name("name-hyphen-spacing")
                        .pattern("\\s*-\\s*")
                        .replacement("-")
                        .applicableFields(PlayerField.LAST_NAME, PlayerField.FIRST_NAME)
                        .priority(50)
                        .build()
        );
    }
}
