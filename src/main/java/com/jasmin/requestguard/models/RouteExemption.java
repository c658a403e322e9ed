package com.jasmin.requestguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-route switches consulted by the request filter. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RouteExemption {

    public static final RouteExemption NONE = new RouteExemption(false, false);

    /** Skip the attack scanner for this route. */
    private boolean wafExempt;

    /** Skip the rate limiter for this route. */
    private boolean rateLimitExempt;
}
