package com.jasmin.requestguard.models;

import lombok.Builder;
import lombok.Value;

/** Who is calling and what: resolved once per request before any pipeline stage runs. */
@Value
@Builder
public class RequestContext {
    String clientIp;

    // null for anonymous callers
    RequestPrincipal principal;

    ClientIdentity identity;
    String path;
    String method;

    public String principalId() {
        return principal == null ? null : principal.getId();
    }

    public boolean isSuperuser() {
        return principal != null && principal.isSuperuser();
    }
}
