package com.jasmin.requestguard.controllers;

import com.jasmin.requestguard.models.BlockStatus;
import com.jasmin.requestguard.models.ManualBlockRequest;
import com.jasmin.requestguard.models.RequestPrincipal;
import com.jasmin.requestguard.services.BlocklistAdminService;
import com.jasmin.requestguard.services.PrincipalResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/admin/blocks")
@RequiredArgsConstructor
public class BlocklistAdminController {

    private final BlocklistAdminService adminService;
    private final PrincipalResolver principalResolver;

    @GetMapping("/{ip}")
    public BlockStatus status(@PathVariable String ip, HttpServletRequest request) {
        requireSuperuser(request);
        return adminService.status(ip);
    }

    @PostMapping
    public BlockStatus block(@Valid @RequestBody ManualBlockRequest body, HttpServletRequest request) {
        String actor = requireSuperuser(request);
        return adminService.block(body.getIp(), Duration.ofSeconds(body.getDurationSeconds()), body.getReason(), actor);
    }

    @DeleteMapping("/{ip}")
    public Map<String, Object> unblock(@PathVariable String ip, HttpServletRequest request) {
        String actor = requireSuperuser(request);
        boolean removed = adminService.unblock(ip, actor);
        return Map.of("ip", ip, "unblocked", true, "stateRemoved", removed);
    }

    private String requireSuperuser(HttpServletRequest request) {
        RequestPrincipal principal = principalResolver.resolve(request)
                .filter(RequestPrincipal::isSuperuser)
                .orElseThrow(SuperuserRequiredException::new);
        return principal.getId();
    }
}
