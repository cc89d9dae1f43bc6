package com.coopvault.scoring;

import lombok.Value;

import java.util.Map;

/**
 * A counterfactual version of a proposal, scored on the same charter goals.
 */
@Value
public class Alternative {
    String label;
    String rationale;
    Map<String, Double> goalScores;
    double composite;
}
