package com.crewlife.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyOtpRequest {

    @NotBlank(message = "Verification reference is required")
    @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid verification reference")
    private String identityRef;

    @NotBlank(message = "Verification code is required")
    @Pattern(regexp = "\\s*\\d{4,8}\\s*", message = "Verification code must be numeric")
    private String otp;
}
