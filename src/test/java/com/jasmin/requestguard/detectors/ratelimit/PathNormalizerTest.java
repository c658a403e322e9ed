package com.jasmin.requestguard.detectors.ratelimit;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PathNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "/api/items/42/, /api/items/:id/",
            "/api/items/42, /api/items/:id",
            "/api/users/7/orders/19/, /api/users/:id/orders/:id/",
            "/api/v2/items/, /api/v2/items/",
            "/api/items/a42/, /api/items/a42/",
            "/, /"
    })
    void replacesNumericSegments(String path, String expected) {
        assertThat(PathNormalizer.normalize(path)).isEqualTo(expected);
    }
}
