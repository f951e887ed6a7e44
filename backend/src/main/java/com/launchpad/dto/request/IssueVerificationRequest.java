package com.launchpad.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for issuing a verification code.
 *
 * Example:
 * <pre>
 * { "identifier": "user@example.com" }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueVerificationRequest {

    @NotBlank(message = "identifier must not be blank")
    @Email(message = "identifier must be a valid email address")
    @Size(max = 255, message = "identifier must be at most 255 characters")
    private String identifier;
}
