package com.jasmin.requestguard.detectors.ratelimit;

/** Groups per-resource endpoints: every all-digit path segment becomes {@code :id}. */
public final class PathNormalizer {

    static final String ID_PLACEHOLDER = ":id";

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) return "/";
        String[] segments = path.split("/", -1);
        StringBuilder sb = new StringBuilder(path.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) sb.append('/');
            sb.append(isNumeric(segments[i]) ? ID_PLACEHOLDER : segments[i]);
        }
        return sb.toString();
    }

    private static boolean isNumeric(String segment) {
        if (segment.isEmpty()) return false;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return false;
        }
        return true;
    }

    private PathNormalizer() {
    }
}
