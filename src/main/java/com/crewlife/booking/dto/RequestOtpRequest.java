package com.crewlife.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields of a signed invitation link, submitted to request a code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RequestOtpRequest {

    @NotBlank(message = "Brand is required")
    private String brand;

    @NotBlank(message = "Email is required")
    @Size(max = 254, message = "Email is too long")
    private String email;

    @NotBlank(message = "Position is required")
    @Size(max = 200, message = "Position is too long")
    private String textForEmail;

    @NotNull(message = "Link timestamp is required")
    private Long ts;

    @NotBlank(message = "Link signature is required")
    private String sig;
}
