package com.jasmin.requestguard.detectors.waf;

import com.jasmin.requestguard.models.AttackPattern;
import com.jasmin.requestguard.models.AttackType;
import com.jasmin.requestguard.models.PatternSet;
import com.jasmin.requestguard.models.SecurityTier;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.jasmin.requestguard.models.AttackType.CMD_INJECTION;
import static com.jasmin.requestguard.models.AttackType.PATH_TRAVERSAL;
import static com.jasmin.requestguard.models.AttackType.SENSITIVE_DATA;
import static com.jasmin.requestguard.models.AttackType.SQLI;
import static com.jasmin.requestguard.models.AttackType.XSS;
import static com.jasmin.requestguard.models.SecurityTier.HIGH;
import static com.jasmin.requestguard.models.SecurityTier.LOW;
import static com.jasmin.requestguard.models.SecurityTier.MEDIUM;

/**
 * Attack signatures per family and tier.
 * <p>
 * The effective set of a tier is, for each {@link AttackType} in declaration order, the patterns
 * registered at that tier or below, in registration order. Building is pure: the same tier always
 * yields the same ordered list, so a higher tier is always a superset of a lower one.
 */
public final class PatternCatalog {

    private static final int CI = Pattern.CASE_INSENSITIVE;
    private static final int NONE = 0;

    private static final List<Definition> DEFINITIONS = List.of(
            /* ================= XSS ================= */
            def(XSS, LOW, "<script.*?>.*?</script.*?>", CI | Pattern.DOTALL),
            def(XSS, LOW, "javascript:", CI),
            def(XSS, LOW, "document\\.cookie", CI),

            def(XSS, MEDIUM, "on(load|error|click|mouseover|submit|keypress|change|focus|blur)=", CI),
            def(XSS, MEDIUM, "document\\.location", CI),
            def(XSS, MEDIUM, "eval\\s*\\(", CI),
            def(XSS, MEDIUM, "alert\\s*\\(", CI),

            def(XSS, HIGH, "String\\.fromCharCode", CI),
            def(XSS, HIGH, "prompt\\s*\\(", CI),
            def(XSS, HIGH, "<img[^>]+\\bonerror\\b[^>]+>", CI),
            def(XSS, HIGH, "<iframe[^>]*>", CI),
            def(XSS, HIGH, "<embed[^>]*>", CI),
            def(XSS, HIGH, "<object[^>]*>", CI),
            def(XSS, HIGH, "<svg[^>]*>", CI),
            def(XSS, HIGH, "expression\\s*\\(", CI),
            def(XSS, HIGH, "url\\s*\\(", CI),
            def(XSS, HIGH, "@import", CI),

            /* ================= SQL injection ================= */
            // [\s;]* rather than (\s|;)*: a repeated group recurses once per character
            def(SQLI, LOW, "[\\s;]*(SELECT|INSERT|UPDATE|DELETE|DROP|ALTER|EXEC|UNION)\\s", CI),
            def(SQLI, LOW, "--\\s", CI),
            def(SQLI, LOW, "/\\*.*?\\*/", CI | Pattern.DOTALL),
            def(SQLI, LOW, "'\\s*OR\\s*'.*?'", CI),
            def(SQLI, LOW, "'\\s*OR\\s*[0-9]", CI),

            def(SQLI, MEDIUM, "[\\s;]*(FROM|WHERE|GROUP BY|ORDER BY|HAVING)\\s", CI),
            def(SQLI, MEDIUM, "#\\s", CI),
            def(SQLI, MEDIUM, "\\bOR\\b.+?[=1]", CI),
            def(SQLI, MEDIUM, "SLEEP\\s*\\(", CI),
            def(SQLI, MEDIUM, "WAITFOR\\s+DELAY", CI),

            def(SQLI, HIGH, "BENCHMARK\\s*\\(", CI),
            def(SQLI, HIGH, "pg_sleep", CI),
            def(SQLI, HIGH, "sys\\.user_tables", CI),
            def(SQLI, HIGH, "information_schema\\.tables", CI),
            def(SQLI, HIGH, "sysobjects", CI),
            def(SQLI, HIGH, "CASE\\s+WHEN", CI),
            def(SQLI, HIGH, "CONVERT\\s*\\(", CI),
            def(SQLI, HIGH, "CHAR\\s*\\(", CI),
            def(SQLI, HIGH, "CONCAT\\s*\\(", CI),
            def(SQLI, HIGH, "VARCHAR", CI),
            def(SQLI, HIGH, "@@version", CI),

            /* ================= command injection ================= */
            def(CMD_INJECTION, LOW, "`.*?`", NONE),
            def(CMD_INJECTION, LOW, "\\$\\(.*?\\)", NONE),
            def(CMD_INJECTION, LOW, "(\\||;|\\$)", CI),

            def(CMD_INJECTION, MEDIUM, "(>|<|\\(|\\))", CI),
            def(CMD_INJECTION, MEDIUM, "\\b(wget|curl|nc|netcat|telnet|ssh)\\b", CI),
            def(CMD_INJECTION, MEDIUM, "\\b(cmd|powershell)\\b", CI),

            // '&' is everywhere in URLs, so it only counts at the high tier
            def(CMD_INJECTION, HIGH, "&", CI),
            def(CMD_INJECTION, HIGH, "\\b(cat|grep|ls|pwd|echo|rm|cp|mv|chmod|chown|touch|find)\\b", CI),
            def(CMD_INJECTION, HIGH, "\\b(start|copy|del|move|ren|dir|erase|cd)\\b", CI),
            def(CMD_INJECTION, HIGH, "\\b(nslookup|ifconfig|ipconfig|netstat|traceroute|gcc|python|perl|php)\\b", CI),

            /* ================= path traversal ================= */
            def(PATH_TRAVERSAL, LOW, "\\.\\.(/|\\\\)", NONE),
            def(PATH_TRAVERSAL, LOW, "etc(/|\\\\)passwd", CI),

            def(PATH_TRAVERSAL, MEDIUM, "\\.\\.(%2f|%5c)", CI),
            def(PATH_TRAVERSAL, MEDIUM, "etc(/|\\\\)shadow", CI),
            def(PATH_TRAVERSAL, MEDIUM, "windows(/|\\\\)win.ini", CI),
            def(PATH_TRAVERSAL, MEDIUM, "boot.ini", CI),

            def(PATH_TRAVERSAL, HIGH, "(%252e%252e)(/|%255c)", CI),
            def(PATH_TRAVERSAL, HIGH, "proc(/|\\\\)self", CI),
            def(PATH_TRAVERSAL, HIGH, "etc(/|\\\\)(group|hosts|motd|issue)", CI),
            def(PATH_TRAVERSAL, HIGH, "\\.ssh(/|\\\\)id_rsa", CI),
            def(PATH_TRAVERSAL, HIGH, "\\.bash_history", CI),
            def(PATH_TRAVERSAL, HIGH, "\\.env", CI),
            def(PATH_TRAVERSAL, HIGH, "config\\.php", CI),
            def(PATH_TRAVERSAL, HIGH, "wp-config\\.php", CI),
            def(PATH_TRAVERSAL, HIGH, "credentials", CI),

            /* ================= sensitive data ================= */
            def(SENSITIVE_DATA, LOW, "(pass|pwd|password)[=:]", CI),
            def(SENSITIVE_DATA, LOW, "4[0-9]{12}(?:[0-9]{3})?", NONE),                  // Visa

            def(SENSITIVE_DATA, MEDIUM, "(api|access)[_-]?(key|token|secret)", CI),
            def(SENSITIVE_DATA, MEDIUM, "5[1-5][0-9]{14}", NONE),                      // Mastercard
            def(SENSITIVE_DATA, MEDIUM, "3[47][0-9]{13}", NONE),                       // Amex
            def(SENSITIVE_DATA, MEDIUM, "\\b\\d{3}-\\d{2}-\\d{4}\\b", NONE),           // US SSN

            def(SENSITIVE_DATA, HIGH, "(app|account|private|secret)[_-]?(key|token|secret|password)", CI),
            def(SENSITIVE_DATA, HIGH, "bearer\\s+[a-zA-Z0-9_\\-\\.]+", CI),
            def(SENSITIVE_DATA, HIGH, "(oauth|refresh)[_-]token", CI),
            def(SENSITIVE_DATA, HIGH, "(jdbc|odbc):.*", CI),
            def(SENSITIVE_DATA, HIGH, "(mongodb|redis|postgres)://.*", CI),
            def(SENSITIVE_DATA, HIGH, "AKIA[0-9A-Z]{16}", NONE),                        // AWS access key id
            def(SENSITIVE_DATA, HIGH, "AWS_SECRET_ACCESS_KEY", CI),
            def(SENSITIVE_DATA, HIGH, "6(?:011|5[0-9]{2})[0-9]{12}", NONE),            // Discover
            def(SENSITIVE_DATA, HIGH, "(?:2131|1800|35\\d{3})\\d{11}", NONE),          // JCB
            def(SENSITIVE_DATA, HIGH, "\\b[A-Z]{2}[0-9]{7}\\b", NONE),                 // passport number
            def(SENSITIVE_DATA, HIGH, "\\b[A-Z]{1,2}[0-9R][0-9A-Z]? [0-9][A-Z]{2}\\b", NONE)
    );

    private PatternCatalog() {
    }

    /**
     * Compiles the pattern set of {@code tier}.
     *
     * @param tier the security tier, never {@code null}
     * @return an immutable, ordered pattern set
     */
    public static PatternSet buildPatterns(SecurityTier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        List<AttackPattern> patterns = new ArrayList<>();
        for (AttackType type : AttackType.values()) {
            for (Definition d : DEFINITIONS) {
                if (d.type == type && tier.includes(d.tier)) {
                    patterns.add(new AttackPattern(d.type, d.tier, Pattern.compile(d.regex, d.flags)));
                }
            }
        }
        return new PatternSet(tier, patterns);
    }

    private static Definition def(AttackType type, SecurityTier tier, String regex, int flags) {
        return new Definition(type, tier, regex, flags);
    }

    private static final class Definition {
        private final AttackType type;
        private final SecurityTier tier;
        private final String regex;
        private final int flags;

        private Definition(AttackType type, SecurityTier tier, String regex, int flags) {
            this.type = type;
            this.tier = tier;
            this.regex = regex;
            this.flags = flags;
        }
    }
}
