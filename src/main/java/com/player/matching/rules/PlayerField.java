package com.player.matching.rules;

/**
 * Text fields of a player record that normalization rules can be scoped to.
 */
public enum PlayerField {
    EXTERNAL_ID,
    LAST_NAME,
    FIRST_NAME,
    SEX,
    ASSOCIATION;

    public boolean isName() {
        return this == LAST_NAME || this == FIRST_NAME;
    }
}
