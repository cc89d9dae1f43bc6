package com.coopvault.scoring;

/**
 * Scoring outcome. Only ADVANCE moves a proposal forward automatically.
 */
public enum Decision {
    ADVANCE,
    REVISE,
    BLOCK
}
