package com.jasmin.requestguard.extractors;

import com.jasmin.requestguard.models.RequestContext;
import com.jasmin.requestguard.models.RequestPrincipal;
import com.jasmin.requestguard.services.PrincipalResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestContextResolver {

    private final ClientIpResolver ipResolver;
    private final ClientIdentityResolver identityResolver;
    private final PrincipalResolver principalResolver;

    public RequestContext resolve(HttpServletRequest request) {
        String ip = ipResolver.resolve(request);
        RequestPrincipal principal = principalResolver.resolve(request).orElse(null);
        return RequestContext.builder()
                .clientIp(ip)
                .principal(principal)
                .identity(identityResolver.resolve(request, principal, ip))
                .path(pathOf(request))
                .method(request.getMethod())
                .build();
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (uri == null || uri.isEmpty()) return "/";
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
