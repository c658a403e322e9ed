package com.jasmin.requestguard.services;

import com.jasmin.requestguard.config.GuardProperties;
import com.jasmin.requestguard.detectors.DetectorUtils;
import com.jasmin.requestguard.models.RequestContext;
import com.jasmin.requestguard.models.RouteExemption;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;

import java.util.Map;

/**
 * Answers the three "skip" questions of the pipeline: excluded path, per-route exemption flags
 * and exempt client. Everything is read from configuration bound at startup.
 */
@Service
@RequiredArgsConstructor
public class ExemptionRegistry {

    private final GuardProperties cfg;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public boolean isExcludedPath(String path) {
        return DetectorUtils.startsWithAny(path, cfg.getExcludedPaths());
    }

    /** Exemption flags of the first route pattern matching {@code path}, {@link RouteExemption#NONE} if none does. */
    public RouteExemption routeExemption(String path) {
        if (path == null) return RouteExemption.NONE;
        for (Map.Entry<String, RouteExemption> route : cfg.getRoutes().entrySet()) {
            if (matcher.match(route.getKey(), path)) {
                return route.getValue() == null ? RouteExemption.NONE : route.getValue();
            }
        }
        return RouteExemption.NONE;
    }

    /** Superusers and clients listed in {@code guard.exemptions} by IP, user id or identity key. */
    public boolean isExemptClient(RequestContext ctx) {
        if (ctx.isSuperuser()) return true;
        var exemptions = cfg.getExemptions();
        if (exemptions.isEmpty()) return false;
        if (ctx.getClientIp() != null && exemptions.contains(ctx.getClientIp())) return true;
        if (ctx.principalId() != null && exemptions.contains(ctx.principalId())) return true;
        return ctx.getIdentity() != null && exemptions.contains(ctx.getIdentity().key());
    }
}
