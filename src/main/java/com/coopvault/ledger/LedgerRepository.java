package com.coopvault.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByFromAccountOrToAccountOrderByCreatedAtDesc(String fromAccount, String toAccount);

    List<LedgerEntry> findByReferenceOrderByCreatedAtAsc(String reference);
}
