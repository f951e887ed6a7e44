package com.launchpad.messaging;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Payload of a dispatch job. Carries the record id only; the worker reloads
 * the record so a code that was replaced or consumed in the meantime is skipped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationDispatchMessage {

    private UUID verificationId;

    private String identifier;
}
