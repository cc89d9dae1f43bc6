package com.coopvault.coopconfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the active configuration of a cooperative into a snapshot, filling
 * unset fields with the configured defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoopConfigService {

    static final List<String> DEFAULT_SECTOR_EXCLUSIONS = List.of("fashion", "restaurant", "cafe", "food truck");

    private final CoopConfigRepository configRepository;

    @Value("${coop-vault.governance.default-council-threshold:5000}")
    private BigDecimal defaultCouncilThreshold;

    @Value("${coop-vault.governance.default-quorum-percent:20}")
    private int defaultQuorumPercent;

    @Value("${coop-vault.governance.default-approval-threshold-percent:60}")
    private int defaultApprovalThresholdPercent;

    @Value("${coop-vault.governance.default-voting-window-days:7}")
    private int defaultVotingWindowDays;

    @Transactional(readOnly = true)
    public CoopConfigSnapshot activeSnapshot(String coopId) {
        Optional<CoopConfig> active = configRepository.findFirstByCoopIdAndActiveTrueOrderByVersionDesc(coopId);
        if (active.isEmpty()) {
            log.debug("No active config for coop {}, using defaults", coopId);
            return CoopConfigSnapshot.builder()
                .coopId(coopId)
                .councilVoteThreshold(defaultCouncilThreshold)
                .quorumPercent(defaultQuorumPercent)
                .approvalThresholdPercent(defaultApprovalThresholdPercent)
                .votingWindowDays(defaultVotingWindowDays)
                .sectorExclusions(DEFAULT_SECTOR_EXCLUSIONS)
                .build();
        }

        CoopConfig config = active.get();
        return CoopConfigSnapshot.builder()
            .coopId(coopId)
            .version(config.getVersion())
            .councilVoteThreshold(orDefault(config.getCouncilVoteThresholdUsd(), defaultCouncilThreshold))
            .quorumPercent(orDefault(config.getQuorumPercent(), defaultQuorumPercent))
            .approvalThresholdPercent(orDefault(config.getApprovalThresholdPercent(), defaultApprovalThresholdPercent))
            .votingWindowDays(orDefault(config.getVotingWindowDays(), defaultVotingWindowDays))
            .scoringWeights(config.getScoringWeights())
            .activeCategories(config.getActiveCategories())
            .sectorExclusions(config.getSectorExclusions())
            .charterText(config.getCharterText())
            .build();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
