package com.tennis.matchdata.model;

/**
 * Circuit a results file belongs to. Matches store the name as their tier and the code as their source code.
 */
public enum SourceTier {
    TOUR("W"),
    ITF("I");

    private final String code;

    SourceTier(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
