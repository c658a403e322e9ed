package com.jasmin.requestguard.services;

import com.jasmin.requestguard.models.RequestPrincipal;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/** Supplies the authenticated caller of a request, if any. Provided by the identity layer. */
public interface PrincipalResolver {
    Optional<RequestPrincipal> resolve(HttpServletRequest request);
}
