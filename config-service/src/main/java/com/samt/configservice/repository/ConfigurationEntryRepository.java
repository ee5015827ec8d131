package com.samt.configservice.repository;

import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.entity.ConfigurationEntry;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ConfigurationEntry entity.
 *
 * Methods suffixed ActiveTrue only see live entries; the others also return
 * retired (soft-deleted) rows.
 */
@Repository
public interface ConfigurationEntryRepository extends JpaRepository<ConfigurationEntry, UUID> {

    Optional<ConfigurationEntry> findByConfigKeyAndActiveTrue(String configKey);

    /**
     * Find entry by key regardless of its active flag.
     */
    Optional<ConfigurationEntry> findByConfigKey(String configKey);

    List<ConfigurationEntry> findByCategoryAndActiveTrueOrderByConfigKeyAsc(String category);

    List<ConfigurationEntry> findByKindAndActiveTrueOrderByConfigKeyAsc(ConfigKind kind);

    List<ConfigurationEntry> findByActiveTrueOrderByCategoryAscConfigKeyAsc();

    /**
     * Load the active entry for a key with a row lock held until commit.
     * Concurrent writers of the same key wait here instead of reading a stale version.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT c FROM ConfigurationEntry c WHERE c.configKey = :configKey AND c.active = true")
    Optional<ConfigurationEntry> findActiveByKeyForUpdate(@Param("configKey") String configKey);

    /**
     * Same as {@link #findActiveByKeyForUpdate} but also locks retired rows (restore).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT c FROM ConfigurationEntry c WHERE c.configKey = :configKey")
    Optional<ConfigurationEntry> findByKeyForUpdate(@Param("configKey") String configKey);

    /**
     * Reachability probe for health checks.
     */
    @Query(value = "SELECT 1", nativeQuery = true)
    Integer ping();
}
