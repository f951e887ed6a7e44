package com.launchpad.controller;

import com.launchpad.bootstrap.MainProcess;
import com.launchpad.dto.request.ConfirmVerificationRequest;
import com.launchpad.dto.request.IssueVerificationRequest;
import com.launchpad.dto.response.VerificationResponse;
import com.launchpad.entity.VerificationEntity;
import com.launchpad.service.VerificationService;
import com.launchpad.web.ApiVersion;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for verification challenges, served at /api/v1/verifications.
 *
 * Flow:
 * 1. Client POSTs an identifier; a code is stored and queued for delivery (202 Accepted)
 * 2. The worker delivers the code out of band
 * 3. Client POSTs the identifier and code to /confirm; the code is consumed (200 OK)
 *
 * Error Responses:
 * - 422 Unprocessable Entity: invalid or unknown request properties
 * - 400 Bad Request: code does not match
 * - 410 Gone: code has expired
 * - 429 Too Many Requests: issue limit or failed-attempt limit reached for the identifier
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 * The code itself is never part of a response, and there is no lookup by
 * identifier: only the caller that issued a code learns its expiry.
 *
 * @see com.launchpad.service.VerificationService
 */
@RestController
@ApiVersion("1")
@MainProcess
@RequestMapping("/verifications")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Verifications", description = "Issue and confirm verification codes")
public class VerificationController {

    private final VerificationService verificationService;

    /**
     * Issue a verification code.
     *
     * Example request:
     * <pre>
     * POST /api/v1/verifications
     * { "identifier": "user@example.com" }
     * </pre>
     *
     * @param request the identifier to verify
     * @return 202 with the record's id, identifier and expiry
     */
    @PostMapping
    @Operation(summary = "Issue a verification code")
    public ResponseEntity<VerificationResponse> issue(@Valid @RequestBody IssueVerificationRequest request) {
        log.info("Verification requested for: {}", request.getIdentifier());
        VerificationEntity verification = verificationService.issue(request.getIdentifier());
        return ResponseEntity.accepted().body(VerificationResponse.issued(verification));
    }

    /**
     * Confirm a verification code.
     *
     * @param request identifier and presented code
     * @return 200 with {@code verified: true}
     */
    @PostMapping("/confirm")
    @Operation(summary = "Confirm a verification code")
    public ResponseEntity<VerificationResponse> confirm(@Valid @RequestBody ConfirmVerificationRequest request) {
        log.info("Verification confirmation for: {}", request.getIdentifier());
        VerificationEntity verification = verificationService.confirm(request.getIdentifier(), request.getValue());
        return ResponseEntity.ok(VerificationResponse.confirmed(verification));
    }
}
