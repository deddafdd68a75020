package com.player.matching.core.model;

/**
 * Secondary discrepancy found once a name-level match exists.
 * Declaration order is the detection order used for issue lists.
 */
public enum MatchIssue {
    DOB_MOB_SWAP("dob-mob-swap"),
    DOB_MISMATCH("dob-mismatch"),
    MOB_MISMATCH("mob-mismatch"),
    SEX_MISMATCH("sex-mismatch"),
    NATIONALITY_MISMATCH("nationality-mismatch"),
    BIRTH_YEAR_MISMATCH("birth-year-mismatch");

    private final String code;

    MatchIssue(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Looks up an issue by its code.
     *
     * @throws IllegalArgumentException if no issue has that code
     */
    public static MatchIssue fromCode(String code) {
        for (MatchIssue issue : values()) {
            if (issue.code.equals(code)) {
                return issue;
            }
        }
        throw new IllegalArgumentException("Unknown issue code: " + code);
    }
}
