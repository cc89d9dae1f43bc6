package com.coopvault.coopconfig;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Versioned cooperative configuration, maintained by an external admin surface.
 *
 * Read-only here: proposals copy what they need from the active version at
 * submission time through {@link CoopConfigSnapshot}.
 */
@Entity
@Table(name = "coop_configs",
    uniqueConstraints = @UniqueConstraint(name = "uk_coop_config_version", columnNames = {"coop_id", "version"}),
    indexes = @Index(name = "idx_coop_config_active", columnList = "coop_id, active"))
@Data
@NoArgsConstructor
public class CoopConfig {

    @Id
    private String configId;

    @Column(name = "coop_id", nullable = false)
    private String coopId;

    @Column(nullable = false)
    private Integer version;

    private boolean active;

    /**
     * Budget at or above which an advancing proposal needs a council vote. Null
     * falls back to the service default.
     */
    @Column(precision = 19, scale = 2)
    private BigDecimal councilVoteThresholdUsd;

    private Integer quorumPercent;

    private Integer approvalThresholdPercent;

    private Integer votingWindowDays;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "coop_config_weights", joinColumns = @JoinColumn(name = "config_id"))
    @MapKeyColumn(name = "goal")
    @Column(name = "weight")
    private Map<String, Double> scoringWeights = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "coop_config_categories", joinColumns = @JoinColumn(name = "config_id"))
    @Column(name = "category")
    private Set<String> activeCategories = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "coop_config_exclusions", joinColumns = @JoinColumn(name = "config_id"))
    @OrderColumn(name = "position")
    @Column(name = "keyword")
    private List<String> sectorExclusions = new ArrayList<>();

    @Column(length = 20000)
    private String charterText;

    @Column(name = "created_at")
    private Instant createdAt;

    public CoopConfig(String coopId, Integer version) {
        this.configId = UUID.randomUUID().toString();
        this.coopId = coopId;
        this.version = version;
        this.active = true;
        this.createdAt = Instant.now();
    }
}
