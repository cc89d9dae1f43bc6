package com.coopvault.vault;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for vault reserve state.
 */
@Repository
public interface VaultReserveRepository extends JpaRepository<VaultReserve, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VaultReserve v WHERE v.coopId = :coopId")
    Optional<VaultReserve> findForUpdate(@Param("coopId") String coopId);
}
