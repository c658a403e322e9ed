package com.jasmin.requestguard.models;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Inspectable surface of a single request. Lives only for the duration of that request.
 * At most one of {@link #structuredBody} and {@link #rawBody} is set.
 */
@Getter
@Builder
public class ScanTarget {

    // lower-cased header name -> values, allow-listed headers removed
    @Builder.Default
    private final Map<String, List<String>> headers = Collections.emptyMap();

    // decoded query parameters: name -> values
    @Builder.Default
    private final Map<String, List<String>> queryParams = Collections.emptyMap();

    // decoded JSON / form body: flattened key -> leaf value (String, Number, Boolean or null)
    private final Map<String, Object> structuredBody;

    // body that could not be decoded as structured data
    private final String rawBody;

    public boolean hasBody() {
        return structuredBody != null || rawBody != null;
    }
}
