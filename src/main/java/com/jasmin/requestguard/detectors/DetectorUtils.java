package com.jasmin.requestguard.detectors;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Collection;

public class DetectorUtils {

    /** Maximum length of a matched fragment written to logs and audit records. */
    public static final int MAX_FRAGMENT_LENGTH = 120;

    /**
     * Returns a non-null, non-blank string.
     * If the input is null or blank, returns "unknown".
     */
    public static String nullSafe(String s) {
        return (s == null || s.isBlank()) ? "unknown" : s;
    }

    /** Never-null string. */
    public static String getValueOrEmptyString(String s) {
        return (s == null) ? "" : s;
    }

    /** True if {@code path} starts with any of {@code prefixes}. */
    public static boolean startsWithAny(String path, Collection<String> prefixes) {
        if (path == null || prefixes == null) return false;
        for (String prefix : prefixes) {
            if (prefix != null && !prefix.isEmpty() && path.startsWith(prefix)) return true;
        }
        return false;
    }

    /** Cuts {@code s} to {@code max} characters, marking the cut with an ellipsis. */
    public static String abbreviate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, Math.max(0, max - 1)) + "…";
    }

    /** Whole seconds left in {@code d}, rounded up, never below 1. */
    public static long ceilSeconds(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) return 1L;
        long seconds = d.getSeconds();
        return d.getNano() > 0 ? seconds + 1 : Math.max(1L, seconds);
    }

    /** Human form of a block duration: "10 minutes", "90 seconds". */
    public static String describe(Duration d) {
        long seconds = d.getSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        return seconds + (seconds == 1 ? " second" : " seconds");
    }

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] out = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            return Integer.toHexString(s.hashCode());
        }
    }

    private DetectorUtils() {
    }
}
