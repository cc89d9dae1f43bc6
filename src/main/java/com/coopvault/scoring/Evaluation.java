package com.coopvault.scoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of scoring a proposal. All scores are in [0, 1].
 */
@Value
@Builder
public class Evaluation {
    Decision decision;
    double alignment;
    double feasibility;
    double composite;

    @Singular
    Map<String, Double> goalScores;

    @Singular
    List<Alternative> alternatives;

    @Singular
    List<CheckResult> checks;

    @Singular
    List<String> reasons;

    @Singular("missing")
    List<MissingData> missingData;

    String engineVersion;
}
