package com.coopvault.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for council votes.
 */
@Repository
public interface ProposalVoteRepository extends JpaRepository<ProposalVote, String> {

    Optional<ProposalVote> findByProposalIdAndVoterWallet(String proposalId, String voterWallet);

    long countByProposalIdAndVote(String proposalId, VoteType vote);

    List<ProposalVote> findByProposalIdOrderByCreatedAtAsc(String proposalId);
}
