package com.jasmin.requestguard.filters;

import com.jasmin.requestguard.constants.Constants;
import com.jasmin.requestguard.controllers.HealthController;
import com.jasmin.requestguard.models.RouteExemption;
import com.jasmin.requestguard.models.SecurityEvent;
import com.jasmin.requestguard.models.Severity;
import com.jasmin.requestguard.support.GuardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("RequestDefenseFilter")
class RequestDefenseFilterTest {

    private static final String XSS_BODY = "{\"q\": \"<script>alert(1)</script>\"}";

    private GuardFixture fx;

    @BeforeEach
    void setUp() {
        fx = new GuardFixture();
        fx.rateLimitProperties.setRules(Map.of("/api/limited/", "3/60s"));
    }

    private MockMvc mvc() {
        return MockMvcBuilders.standaloneSetup(new SampleController(), new HealthController())
                .addFilters(fx.filter())
                .build();
    }

    @Test
    @DisplayName("XSS payload from a fresh IP is rejected and counted once")
    void rejectsXssPayload() throws Exception {
        perform(mvc(), xss("203.0.113.7"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value(Constants.WAF_ERROR))
                .andExpect(jsonPath("$.detail").value(Constants.WAF_DETAIL));

        assertThat(fx.store.get("waf:violation_count:203.0.113.7")).contains("1");

        SecurityEvent event = fx.auditSink.last();
        assertThat(event.getEventType()).isEqualTo(Constants.SUSPICIOUS_ACTIVITY);
        assertThat(event.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(event.getClientIp()).isEqualTo("203.0.113.7");
        assertThat(event.getDetails())
                .containsEntry("attack_type", "xss")
                .containsEntry("path", "/api/query/")
                .containsEntry("violation_count", 1L)
                .containsEntry("ip_blocked", false);
    }

    @Test
    @DisplayName("Third attack blocks the IP, after which even benign requests are rejected")
    void thirdAttackBlocks() throws Exception {
        MockMvc mvc = mvc();
        String ip = "203.0.113.8";

        perform(mvc, xss(ip)).andExpect(jsonPath("$.detail").value(Constants.WAF_DETAIL));
        perform(mvc, xss(ip)).andExpect(jsonPath("$.detail").value(Constants.WAF_DETAIL));
        perform(mvc, xss(ip))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value(Constants.WAF_ERROR))
                .andExpect(jsonPath("$.detail").value(containsString("blocked for 10 minutes")));

        perform(mvc, get("/api/items/5").with(remoteAddr(ip)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value(Constants.BLOCK_ERROR))
                .andExpect(jsonPath("$.detail").value(Constants.BLOCK_DETAIL));

        assertThat(fx.auditSink.ofType(Constants.SUSPICIOUS_ACTIVITY)).hasSize(3);
    }

    @Test
    @DisplayName("Block lapses after block-duration")
    void blockLapses() throws Exception {
        MockMvc mvc = mvc();
        String ip = "203.0.113.9";
        for (int i = 0; i < 3; i++) perform(mvc, xss(ip));

        fx.clock.advance(Duration.ofSeconds(601));

        perform(mvc, get("/api/items/5").with(remoteAddr(ip))).andExpect(status().isOk());
    }

    @Test
    @DisplayName("Block gate also applies to excluded paths")
    void blockGateBeforeExclusions() throws Exception {
        fx.ledger().block("203.0.113.10", Duration.ofMinutes(5));

        perform(mvc(), get("/health/").with(remoteAddr("203.0.113.10")))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Benign request passes with rate-limit headers and an intact body")
    void benignRequestPasses() throws Exception {
        perform(mvc(), post("/api/echo/")
                .with(remoteAddr("198.51.100.1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"hello world\"}"))
                .andExpect(status().isOk())
                .andExpect(content().string("{\"title\":\"hello world\"}"))
                .andExpect(header().string(Constants.X_RATE_LIMIT_LIMIT, "60"))
                .andExpect(header().string(Constants.X_RATE_LIMIT_REMAINING, "59"))
                .andExpect(header().string(Constants.RATE_LIMIT_REMAINING, "59"))
                .andExpect(header().string(Constants.RATE_LIMIT_RESET, "60"));
    }

    @Test
    @DisplayName("Fourth request within the window gets 429 with rate-limit headers")
    void rateLimited() throws Exception {
        MockMvc mvc = mvc();
        for (int i = 0; i < 3; i++) {
            perform(mvc, get("/api/limited/").with(remoteAddr("198.51.100.2"))).andExpect(status().isOk());
        }

        perform(mvc, get("/api/limited/").with(remoteAddr("198.51.100.2")))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value(Constants.RATE_LIMIT_ERROR))
                .andExpect(jsonPath("$.message").value(Constants.RATE_LIMIT_MESSAGE))
                .andExpect(jsonPath("$.request_count").value(4))
                .andExpect(jsonPath("$.limit").value(3))
                .andExpect(jsonPath("$.period").value("60 seconds"))
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(header().string(Constants.X_RATE_LIMIT_REMAINING, "0"))
                .andExpect(header().string(Constants.RATE_LIMIT_REMAINING, "0"))
                .andExpect(header().string(Constants.X_RATE_LIMIT_RESET,
                        String.valueOf(GuardFixture.START.getEpochSecond() + 60)));

        fx.clock.advance(Duration.ofSeconds(61));
        perform(mvc, get("/api/limited/").with(remoteAddr("198.51.100.2")))
                .andExpect(status().isOk())
                .andExpect(header().string(Constants.X_RATE_LIMIT_REMAINING, "2"));
    }

    @Test
    @DisplayName("Rate-limit block answers with the blocked message")
    void rateLimitBlock() throws Exception {
        fx.rateLimitProperties.setBlockDuration(Duration.ofSeconds(300));
        MockMvc mvc = mvc();
        for (int i = 0; i < 4; i++) perform(mvc, get("/api/limited/").with(remoteAddr("198.51.100.3")));

        perform(mvc, get("/api/items/1").with(remoteAddr("198.51.100.3")))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.message").value(Constants.RATE_LIMIT_BLOCKED_MESSAGE))
                .andExpect(jsonPath("$.request_count").doesNotExist())
                .andExpect(header().string("Retry-After", "300"));
    }

    @Test
    @DisplayName("Superuser bypasses both the scanner and the rate limiter")
    void superuserBypasses() throws Exception {
        MockMvc mvc = mvc();
        for (int i = 0; i < 5; i++) {
            perform(mvc, xss("192.0.2.50").with(user("root", "SUPERUSER")))
                    .andExpect(status().isOk())
                    .andExpect(header().doesNotExist(Constants.X_RATE_LIMIT_LIMIT));
        }
        assertThat(fx.auditSink.events()).isEmpty();
        assertThat(fx.store.get("waf:violation_count:192.0.2.50")).isEmpty();
    }

    @Test
    @DisplayName("Clients on the exemption list bypass the pipeline by IP or user id")
    void exemptionListBypasses() throws Exception {
        fx.guardProperties.setExemptions(List.of("192.0.2.60", "svc-reporting"));
        MockMvc mvc = mvc();

        perform(mvc, xss("192.0.2.60")).andExpect(status().isOk());
        perform(mvc, xss("192.0.2.61").with(user("svc-reporting"))).andExpect(status().isOk());
        perform(mvc, xss("192.0.2.62").with(user("someone-else"))).andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Excluded paths skip the pipeline regardless of payload")
    void excludedPathBypasses() throws Exception {
        perform(mvc(), get("/health/").queryParam("q", "<script>alert(1)</script>")
                .with(remoteAddr("192.0.2.70")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        assertThat(fx.auditSink.events()).isEmpty();
    }

    @Test
    @DisplayName("Route flags exempt a route from the scanner or the limiter only")
    void routeExemptions() throws Exception {
        fx.guardProperties.getRoutes().put("/api/query/**", new RouteExemption(true, false));
        fx.guardProperties.getRoutes().put("/api/limited/**", new RouteExemption(false, true));
        MockMvc mvc = mvc();

        perform(mvc, xss("192.0.2.80"))
                .andExpect(status().isOk())
                .andExpect(header().string(Constants.X_RATE_LIMIT_LIMIT, "60"));

        for (int i = 0; i < 5; i++) {
            perform(mvc, get("/api/limited/").with(remoteAddr("192.0.2.81")))
                    .andExpect(status().isOk())
                    .andExpect(header().doesNotExist(Constants.X_RATE_LIMIT_LIMIT));
        }
    }

    @Test
    @DisplayName("Store outage: benign requests still reach the handler")
    void failsOpenOnStoreOutage() throws Exception {
        fx.store.setFailing(true);

        perform(mvc(), get("/api/limited/").with(remoteAddr("192.0.2.90")))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist(Constants.X_RATE_LIMIT_LIMIT));
    }

    @Test
    @DisplayName("Store outage: attacks are still rejected, just not counted")
    void attackRejectedDuringOutage() throws Exception {
        fx.store.setFailing(true);

        perform(mvc(), xss("192.0.2.91"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value(Constants.WAF_DETAIL));

        assertThat(fx.auditSink.last().getDetails()).containsEntry("violation_count", null);
    }

    @Test
    @DisplayName("With the WAF disabled attacks pass and the block gate is off")
    void wafDisabled() throws Exception {
        fx.wafProperties.setEnabled(false);
        fx.ledger().block("192.0.2.92", Duration.ofMinutes(5));

        perform(mvc(), xss("192.0.2.92")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("X-Forwarded-For is only trusted from configured proxies")
    void forwardedForFromTrustedProxy() throws Exception {
        fx.guardProperties.setTrustedProxies(List.of("10.0.0.1"));
        MockMvc mvc = mvc();

        perform(mvc, xss("10.0.0.1").header("X-Forwarded-For", "203.0.113.99, 10.0.0.1"));
        perform(mvc, xss("10.9.9.9").header("X-Forwarded-For", "203.0.113.99"));

        assertThat(fx.store.get("waf:violation_count:203.0.113.99")).contains("1");
        assertThat(fx.store.get("waf:violation_count:10.9.9.9")).contains("1");
    }

    @Test
    @DisplayName("A body that exhausts the scan budget is let through quickly and not counted")
    void scanBudgetFailsOpen() {
        String body = "<script>".repeat(8 * 1024);
        MockMvc mvc = mvc();

        assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
                perform(mvc, post("/api/echo/")
                        .with(remoteAddr("192.0.2.93"))
                        .contentType(MediaType.TEXT_PLAIN)
                        .content(body))
                        .andExpect(status().isOk())
                        .andExpect(content().string(body)));

        assertThat(fx.store.get("waf:violation_count:192.0.2.93")).isEmpty();
    }

    @Test
    @DisplayName("A body above max-body-bytes reaches the handler intact")
    void oversizedBodyReachesHandler() throws Exception {
        fx.wafProperties.setMaxBodyBytes(1024);
        String body = "lorem ipsum dolor sit amet ".repeat(10_000);

        perform(mvc(), post("/api/echo/")
                .with(remoteAddr("192.0.2.94"))
                .contentType(MediaType.TEXT_PLAIN)
                .content(body))
                .andExpect(status().isOk())
                .andExpect(content().string(body));
    }

    private static ResultActions perform(MockMvc mvc, MockHttpServletRequestBuilder request) throws Exception {
        return mvc.perform(request);
    }

    private static MockHttpServletRequestBuilder xss(String ip) {
        return post("/api/query/")
                .with(remoteAddr(ip))
                .contentType(MediaType.APPLICATION_JSON)
                .content(XSS_BODY);
    }

    private static RequestPostProcessor remoteAddr(String ip) {
        return request -> {
            request.setRemoteAddr(ip);
            return request;
        };
    }

    private static RequestPostProcessor user(String name, String... roles) {
        return request -> {
            request.setUserPrincipal(() -> name);
            for (String role : roles) request.addUserRole(role);
            return request;
        };
    }

    @RestController
    static class SampleController {

        @PostMapping("/api/query/")
        public Map<String, Object> query(@RequestBody Map<String, Object> body) {
            return Map.of("ok", true);
        }

        @PostMapping(value = "/api/echo/", produces = MediaType.APPLICATION_JSON_VALUE)
        public String echo(@RequestBody String body) {
            return body;
        }

        @GetMapping("/api/items/{id}")
        public Map<String, Object> item(@PathVariable String id) {
            return Map.of("id", id);
        }

        @GetMapping("/api/limited/")
        public Map<String, Object> limited() {
            return Map.of("ok", true);
        }
    }
}
