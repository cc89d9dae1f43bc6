package com.coopvault.coopconfig;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for cooperative configuration versions.
 */
@Repository
public interface CoopConfigRepository extends JpaRepository<CoopConfig, String> {

    Optional<CoopConfig> findFirstByCoopIdAndActiveTrueOrderByVersionDesc(String coopId);
}
