package com.coopvault.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A council member's vote on a proposal. One row per voter; voting again overwrites.
 */
@Entity
@Table(name = "proposal_votes",
    uniqueConstraints = @UniqueConstraint(name = "uk_proposal_vote", columnNames = {"proposal_id", "voter_wallet"}))
@Data
@NoArgsConstructor
public class ProposalVote {

    @Id
    private String voteId;

    @Column(name = "proposal_id", nullable = false)
    private String proposalId;

    @Column(name = "voter_wallet", nullable = false)
    private String voterWallet;

    @Enumerated(EnumType.STRING)
    private VoteType vote;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ProposalVote(String proposalId, String voterWallet, VoteType vote) {
        this.voteId = UUID.randomUUID().toString();
        this.proposalId = proposalId;
        this.voterWallet = voterWallet;
        this.vote = vote;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void change(VoteType vote) {
        this.vote = vote;
        this.updatedAt = Instant.now();
    }
}
