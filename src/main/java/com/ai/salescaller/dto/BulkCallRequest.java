package com.ai.salescaller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class BulkCallRequest {

    @NotEmpty
    private List<String> customerIds;

    /** Pause between calls; the configured spacing when absent. */
    @Min(0)
    @Max(60_000)
    private Long delayMs;
}
