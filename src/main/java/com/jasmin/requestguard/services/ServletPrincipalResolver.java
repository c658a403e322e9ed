package com.jasmin.requestguard.services;

import com.jasmin.requestguard.config.GuardProperties;
import com.jasmin.requestguard.models.RequestPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.Principal;
import java.util.Optional;

/**
 * Reads the principal the servlet container (or an upstream authentication filter) attached to
 * the request. Superuser status comes from {@code guard.superuser-role}.
 */
@Component
@RequiredArgsConstructor
public class ServletPrincipalResolver implements PrincipalResolver {

    private final GuardProperties cfg;

    @Override
    public Optional<RequestPrincipal> resolve(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new RequestPrincipal(principal.getName(), request.isUserInRole(cfg.getSuperuserRole())));
    }
}
