package com.crewlife.booking.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin request naming a candidate invite. {@code textForEmail} is optional for revocation,
 * where omitting it covers every position of the brand.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateInviteRequest {

    @NotBlank(message = "Brand is required")
    private String brand;

    @NotBlank(message = "Email is required")
    private String email;

    private String textForEmail;

    @NotBlank(message = "Actor is required")
    private String actor;

    private String reason;
}
