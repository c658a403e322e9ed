package com.jasmin.requestguard.services;

import com.jasmin.requestguard.models.ClientIdentity;

public class KeyManager {
    public static final String SECURITY_EVENTS_STREAM = "security:events";

    private static final String NS_WAF_VIOLATIONS = "waf:violation_count";
    private static final String NS_WAF_BLOCK = "waf:ip_block";
    private static final String NS_RATE_LIMIT = "ratelimit";

    public static String violationKey(String ip) {
        return NS_WAF_VIOLATIONS + ":" + ip;
    }

    public static String ipBlockKey(String ip) {
        return NS_WAF_BLOCK + ":" + ip;
    }

    public static String rateWindowKey(ClientIdentity identity, String normalizedPath) {
        return NS_RATE_LIMIT + ":" + identity.key() + ":" + normalizedPath + ":count";
    }

    public static String actionWindowKey(ClientIdentity identity, String action) {
        return NS_RATE_LIMIT + ":" + identity.key() + ":" + action + ":count";
    }

    public static String rateBlockKey(ClientIdentity identity) {
        return NS_RATE_LIMIT + ":" + identity.key() + ":blocked";
    }

    private KeyManager() {
    }
}
