package com.jasmin.requestguard.config;

import com.jasmin.requestguard.models.RouteExemption;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    /** Path prefixes that skip both the attack scanner and the rate limiter (checked after the block gate). */
    @NotNull
    private List<String> excludedPaths = List.of(
            "/admin/", "/static/", "/media/", "/health/",
            "/api/health/", "/api/static/", "/api/media/"
    );

    /** Client IPs, user ids ("42") or identity keys ("user:42") that bypass scanning and rate limiting. */
    @NotNull
    private List<String> exemptions = List.of();

    /** Direct peers allowed to supply X-Forwarded-For. Empty means the socket address is always used. */
    @NotNull
    private List<String> trustedProxies = List.of();

    /** Servlet role that marks a superuser principal. */
    @NotBlank
    private String superuserRole = "SUPERUSER";

    /** Route table: ant pattern -> exemption switches. First matching pattern wins. */
    @NotNull
    private Map<String, RouteExemption> routes = new LinkedHashMap<>();
}
