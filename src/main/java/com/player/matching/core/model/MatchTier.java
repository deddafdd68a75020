package com.player.matching.core.model;

/**
 * The matching strategy that produced an outcome, in strict priority order.
 */
public enum MatchTier {
    /**
     * Last and first name equal after normalization.
     */
    EXACT("exact"),

    /**
     * Event last name equals reference first name and vice versa.
     */
    NAME_SWAP("name-swap"),

    /**
     * Combined Jaro-Winkler name similarity at or above the fuzzy threshold.
     */
    FUZZY("fuzzy"),

    /**
     * No reference record satisfied any tier.
     */
    NONE("none");

    private final String code;

    MatchTier(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isMatch() {
        return this != NONE;
    }
}
