package com.jasmin.requestguard.extractors;

import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.models.ClientIdentity;
import com.jasmin.requestguard.models.RequestPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Picks the rate-limit key of a request: API token first, then authenticated user, then IP.
 * Tokens are hashed so raw credentials never reach the store or the logs.
 */
@Component
public class ClientIdentityResolver {

    private static final String[] TOKEN_SCHEMES = {"Bearer ", "Token "};

    public ClientIdentity resolve(HttpServletRequest request, RequestPrincipal principal, String clientIp) {
        String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            return ClientIdentity.token(DetectorUtils.sha256Hex(token));
        }
        if (principal != null && principal.getId() != null && !principal.getId().isBlank()) {
            return ClientIdentity.user(principal.getId());
        }
        return ClientIdentity.ip(DetectorUtils.nullSafe(clientIp));
    }

    static String extractToken(String authorization) {
        if (authorization == null) return null;
        for (String scheme : TOKEN_SCHEMES) {
            if (authorization.regionMatches(true, 0, scheme, 0, scheme.length())) {
                String token = authorization.substring(scheme.length()).trim();
                return token.isEmpty() ? null : token;
            }
        }
        return null;
    }
}
