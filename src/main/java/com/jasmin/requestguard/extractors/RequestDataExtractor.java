package com.jasmin.requestguard.extractors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.requestguard.detectors.waf.WafProperties;
import com.jasmin.requestguard.models.ScanTarget;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link ScanTarget} of a request: headers minus the allow-list, decoded query
 * parameters and the decoded body.
 * <p>
 * Bodies longer than {@code guard.waf.max-body-bytes} are cut to that length before decoding, so
 * only the leading bytes of a large upload are scanned (a cut JSON document usually degrades to
 * raw-string scanning). Decoding never throws: anything that is not valid JSON or form data is
 * scanned as an opaque string.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestDataExtractor {

    private static final ObjectMapper OM = new ObjectMapper();

    private final WafProperties cfg;

    public ScanTarget extract(HttpServletRequest request) {
        ScanTarget.ScanTargetBuilder target = ScanTarget.builder()
                .headers(extractHeaders(request))
                .queryParams(UrlEncodedParser.parse(request.getQueryString()));

        if (request instanceof CachedBodyHttpServletRequest cached) {
            applyBody(target, cached.getCachedBody(), request.getContentType(), charsetOf(request));
        } else if (isMultipart(request.getContentType())) {
            target.structuredBody(multipartFields(request));
        }
        return target.build();
    }

    /** Decodes {@code body} according to {@code contentType} into the body part of {@code target}. */
    void applyBody(ScanTarget.ScanTargetBuilder target, byte[] body, String contentType, Charset charset) {
        if (body == null || body.length == 0) {
            return;
        }
        byte[] scanned = body;
        if (body.length > cfg.getMaxBodyBytes()) {
            log.debug("Truncating body of {} bytes to {} bytes for scanning", body.length, cfg.getMaxBodyBytes());
            scanned = Arrays.copyOf(body, cfg.getMaxBodyBytes());
        }
        String text = new String(scanned, charset);

        if (isJson(contentType)) {
            try {
                JsonNode root = OM.readTree(text);
                if (root != null && !root.isMissingNode()) {
                    if (root.isTextual()) {
                        target.rawBody(root.textValue());
                    } else {
                        Map<String, Object> leaves = new LinkedHashMap<>();
                        flatten(root, "", leaves);
                        target.structuredBody(leaves);
                    }
                    return;
                }
            } catch (Exception e) {
                log.debug("Body is not valid JSON, scanning as raw text: {}", e.getMessage());
            }
            target.rawBody(text);
            return;
        }

        if (isForm(contentType)) {
            target.structuredBody(flattenMultiMap(UrlEncodedParser.parse(text)));
            return;
        }

        target.rawBody(text);
    }

    private Map<String, List<String>> extractHeaders(HttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        if (names == null) {
            return headers;
        }
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            if (name == null) continue;
            String lower = name.toLowerCase(Locale.ROOT);
            if (isExcludedHeader(lower)) continue;
            List<String> values = headers.computeIfAbsent(lower, _k -> new ArrayList<>());
            Enumeration<String> vals = request.getHeaders(name);
            if (vals != null) {
                values.addAll(Collections.list(vals));
            }
        }
        return headers;
    }

    private boolean isExcludedHeader(String lowerName) {
        for (String excluded : cfg.getExcludedHeaders()) {
            String e = excluded.toLowerCase(Locale.ROOT);
            if (e.endsWith("*")) {
                if (lowerName.startsWith(e.substring(0, e.length() - 1))) return true;
            } else if (lowerName.equals(e)) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> multipartFields(HttpServletRequest request) {
        try {
            Map<String, List<String>> fields = new LinkedHashMap<>();
            request.getParameterMap().forEach((k, v) -> fields.put(k, Arrays.asList(v)));
            return flattenMultiMap(fields);
        } catch (RuntimeException e) {
            log.debug("Could not read multipart fields, body not scanned: {}", e.getMessage());
            return null;
        }
    }

    private static void flatten(JsonNode node, String path, Map<String, Object> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(field.getValue(), path.isEmpty() ? field.getKey() : path + "." + field.getKey(), out);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(node.get(i), path + "[" + i + "]", out);
            }
        } else if (node.isTextual()) {
            out.put(path, node.textValue());
        } else if (node.isNumber()) {
            out.put(path, node.numberValue());
        } else if (node.isBoolean()) {
            out.put(path, node.booleanValue());
        } else {
            out.put(path, null);
        }
    }

    private static Map<String, Object> flattenMultiMap(Map<String, List<String>> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, list) -> {
            for (int i = 0; i < list.size(); i++) {
                out.put(i == 0 ? k : k + "[" + i + "]", list.get(i));
            }
        });
        return out;
    }

    private static boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    private static boolean isForm(String contentType) {
        return matches(MediaType.APPLICATION_FORM_URLENCODED, contentType);
    }

    public static boolean isMultipart(String contentType) {
        return matches(MediaType.MULTIPART_FORM_DATA, contentType);
    }

    private static boolean matches(MediaType expected, String contentType) {
        if (contentType == null) return false;
        try {
            return expected.includes(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Charset charsetOf(HttpServletRequest request) {
        String encoding = request.getCharacterEncoding();
        if (encoding == null) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }
}
