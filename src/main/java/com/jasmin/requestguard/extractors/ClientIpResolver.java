package com.jasmin.requestguard.extractors;

import com.jasmin.requestguard.config.GuardProperties;
import com.jasmin.requestguard.detectors.DetectorUtils;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the client IP used for WAF blocking. The first {@code X-Forwarded-For} hop is used
 * only when the direct peer is a configured trusted proxy; otherwise the socket address wins.
 */
@Component
@RequiredArgsConstructor
public class ClientIpResolver {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final GuardProperties cfg;

    public String resolve(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        if (remote != null && cfg.getTrustedProxies().contains(remote)) {
            String xff = request.getHeader(X_FORWARDED_FOR);
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return DetectorUtils.nullSafe(remote);
    }
}
