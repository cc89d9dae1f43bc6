package com.coopvault.redemption;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for redemption requests.
 */
@Repository
public interface RedemptionRepository extends JpaRepository<RedemptionRequest, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RedemptionRequest r WHERE r.requestId = :requestId")
    Optional<RedemptionRequest> findForUpdate(@Param("requestId") String requestId);

    Optional<RedemptionRequest> findByIdempotencyKey(String idempotencyKey);

    List<RedemptionRequest> findByStatusOrderByCreatedAtAsc(RedemptionStatus status);

    List<RedemptionRequest> findByRequesterOrderByCreatedAtDesc(String requester);

    List<RedemptionRequest> findByRequesterAndStatusOrderByCreatedAtDesc(String requester, RedemptionStatus status);

    List<RedemptionRequest> findAllByOrderByCreatedAtDesc();
}
