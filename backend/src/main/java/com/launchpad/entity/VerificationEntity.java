package com.launchpad.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A pending verification challenge: a secret value issued to an identifier
 * (typically an email address) that stays valid until {@code expiresAt}.
 *
 * A record is expired once {@code expiresAt} is not after the reference time;
 * an expired record is never accepted as a match.
 *
 * Database Table: verification
 */
@Entity
@Table(name = "verification", indexes = {
        @Index(name = "idx_verification_identifier", columnList = "identifier"),
        @Index(name = "idx_verification_expires_at", columnList = "expiresAt")
})
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "value")
public class VerificationEntity extends BaseModel {

    /**
     * Who the challenge was issued to. Stored normalized (trimmed, lower-case).
     */
    @Column(name = "identifier", nullable = false)
    private String identifier;

    /**
     * The secret the holder must present. Never serialized.
     */
    @JsonIgnore
    @Column(name = "value", nullable = false)
    private String value;

    @Column(name = "expiresAt", nullable = false)
    private LocalDateTime expiresAt;

    public VerificationEntity(String identifier, String value, LocalDateTime expiresAt) {
        this.identifier = identifier;
        this.value = value;
        this.expiresAt = expiresAt;
    }

    /**
     * @param now reference time
     * @return true if {@code expiresAt} is at or before {@code now}
     */
    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
