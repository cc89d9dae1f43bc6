package com.coopvault.governance;

import com.coopvault.scoring.ProposalCategory;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for proposals.
 */
@Repository
public interface ProposalRepository extends JpaRepository<Proposal, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Proposal p WHERE p.proposalId = :proposalId")
    Optional<Proposal> findForUpdate(@Param("proposalId") String proposalId);

    List<Proposal> findByProposerWalletOrderByCreatedAtDesc(String proposerWallet);

    @Query("SELECT p FROM Proposal p WHERE (:status IS NULL OR p.status = :status) "
        + "AND (:category IS NULL OR p.category = :category) "
        + "AND (:regionCode IS NULL OR p.regionCode = :regionCode)")
    Page<Proposal> search(@Param("status") ProposalStatus status,
                          @Param("category") ProposalCategory category,
                          @Param("regionCode") String regionCode,
                          Pageable pageable);
}
