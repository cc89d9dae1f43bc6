package com.coopvault.access;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for role grants.
 */
@Repository
public interface RoleGrantRepository extends JpaRepository<RoleGrant, String> {

    boolean existsByPrincipalAndRole(String principal, Role role);

    List<RoleGrant> findByPrincipal(String principal);

    long countByRole(Role role);

    /**
     * Lock every grant of a role so that concurrent revocations serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM RoleGrant g WHERE g.role = :role")
    List<RoleGrant> lockByRole(@Param("role") Role role);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RoleGrant g WHERE g.principal = :principal AND g.role = :role")
    int deleteGrant(@Param("principal") String principal, @Param("role") Role role);

    /**
     * Delete a grant only while another principal still holds the same role.
     *
     * @return 1 if the grant was removed, 0 if it does not exist or is the last one
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RoleGrant g WHERE g.principal = :principal AND g.role = :role "
        + "AND (SELECT COUNT(o) FROM RoleGrant o WHERE o.role = :role AND o.principal <> :principal) > 0")
    int deleteGrantIfNotLast(@Param("principal") String principal, @Param("role") Role role);
}
