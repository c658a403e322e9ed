package com.jasmin.requestguard.models;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ManualBlockRequest {
    @NotBlank
    private String ip;

    @Min(1)
    private long durationSeconds = 600;

    private String reason;
}
