package com.coopvault.coopconfig;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of the configuration a proposal is evaluated and routed against.
 */
@Value
@Builder(toBuilder = true)
public class CoopConfigSnapshot {
    String coopId;

    /**
     * Config version, null when no config row exists and defaults apply.
     */
    Integer version;

    BigDecimal councilVoteThreshold;
    int quorumPercent;
    int approvalThresholdPercent;
    int votingWindowDays;

    /**
     * Goal weights for scoring; empty means the engine's default weights.
     */
    @Singular
    Map<String, Double> scoringWeights;

    @Singular
    Set<String> activeCategories;

    @Singular
    List<String> sectorExclusions;

    String charterText;
}
