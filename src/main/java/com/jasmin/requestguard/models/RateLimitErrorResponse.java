package com.jasmin.requestguard.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitErrorResponse {
    private String error;
    private String message;

    @JsonProperty("request_count")
    private Long requestCount;

    private Integer limit;
    private String period;
}
