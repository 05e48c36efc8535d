package com.crewlife.booking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmAccessRequest {

    @NotBlank(message = "Token is required")
    @Size(max = 128, message = "Token is too long")
    private String token;
}
