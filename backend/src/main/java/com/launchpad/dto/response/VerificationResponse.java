package com.launchpad.dto.response;

import com.launchpad.entity.VerificationEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Public view of a verification record. The secret value is never included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResponse {

    private UUID id;

    private String identifier;

    private LocalDateTime expiresAt;

    private LocalDateTime createdAt;

    private Boolean pending;

    private Boolean verified;

    public static VerificationResponse issued(VerificationEntity verification) {
        return VerificationResponse.builder()
                .id(verification.getId())
                .identifier(verification.getIdentifier())
                .expiresAt(verification.getExpiresAt())
                .createdAt(verification.getCreatedAt())
                .pending(true)
                .build();
    }

    public static VerificationResponse confirmed(VerificationEntity verification) {
        return VerificationResponse.builder()
                .identifier(verification.getIdentifier())
                .verified(true)
                .build();
    }
}
