package com.launchpad.repository;

import com.launchpad.entity.VerificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for VerificationEntity operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime.
 */
@Repository
public interface VerificationRepository extends JpaRepository<VerificationEntity, UUID> {

    /**
     * Find the record matching both identifier and secret value.
     *
     * @param identifier normalized identifier
     * @param value the presented secret
     * @return matching record, expired or not
     */
    Optional<VerificationEntity> findFirstByIdentifierAndValue(String identifier, String value);

    /**
     * Remove every record for an identifier, used when a new challenge replaces old ones.
     *
     * @param identifier normalized identifier
     * @return number of records removed
     */
    @Modifying
    @Query("DELETE FROM VerificationEntity v WHERE v.identifier = :identifier")
    int deleteByIdentifier(@Param("identifier") String identifier);

    /**
     * Bulk-delete records whose expiry is at or before the given time.
     *
     * @param now reference time
     * @return number of records removed
     */
    @Modifying
    @Query("DELETE FROM VerificationEntity v WHERE v.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);

    /**
     * Count records still valid at the given time.
     *
     * @param now reference time
     * @return number of pending records
     */
    long countByExpiresAtAfter(LocalDateTime now);
}
