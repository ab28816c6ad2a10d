package com.ai.salescaller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class OutboundCallRequest {

    @NotBlank
    @Pattern(regexp = "\\+?[0-9 ()\\-.]{7,20}", message = "must be a phone number")
    private String phoneNumber;
}
