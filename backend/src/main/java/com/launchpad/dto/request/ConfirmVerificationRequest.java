package com.launchpad.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for confirming a verification code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmVerificationRequest {

    @NotBlank(message = "identifier must not be blank")
    @Size(max = 255, message = "identifier must be at most 255 characters")
    private String identifier;

    @NotBlank(message = "value must not be blank")
    @Pattern(regexp = "\\d{4,9}", message = "value must be a numeric code")
    private String value;
}
