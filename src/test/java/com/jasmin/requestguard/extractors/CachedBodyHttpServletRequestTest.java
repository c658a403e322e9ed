package com.jasmin.requestguard.extractors;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CachedBodyHttpServletRequest")
class CachedBodyHttpServletRequestTest {

    @Test
    @DisplayName("A body above the bound is buffered only up to bound + 1 and replayed intact")
    void oversizedBodyIsStreamedThrough() throws IOException {
        byte[] body = "x".repeat(1024 * 1024).getBytes(StandardCharsets.US_ASCII);
        ByteArrayInputStream source = new ByteArrayInputStream(body);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/upload/");
        request.setContentType(MediaType.APPLICATION_OCTET_STREAM_VALUE);

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(streaming(request, source), 16);

        assertThat(cached.getCachedBody()).hasSize(17);
        assertThat(cached.isFullyCached()).isFalse();
        assertThat(source.available()).isEqualTo(body.length - 17);

        byte[] replayed = StreamUtils.copyToByteArray(cached.getInputStream());
        assertThat(replayed).isEqualTo(body);
        assertThat(cached.getInputStream().isFinished()).isTrue();
    }

    @Test
    @DisplayName("A body within the bound is fully cached and can be read repeatedly")
    void smallBodyReplaysRepeatedly() throws IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/notes/");
        request.setContentType(MediaType.TEXT_PLAIN_VALUE);
        request.setContent("hello".getBytes(StandardCharsets.UTF_8));

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, 16);

        assertThat(cached.isFullyCached()).isTrue();
        assertThat(StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    @DisplayName("A body exactly at the bound counts as fully cached")
    void bodyAtBound() throws IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/notes/");
        request.setContent("0123456789abcdef".getBytes(StandardCharsets.UTF_8));

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, 16);

        assertThat(cached.getCachedBody()).hasSize(16);
        assertThat(cached.isFullyCached()).isTrue();
    }

    @Test
    @DisplayName("Form parameters of an oversized form body are parsed from the whole body")
    void oversizedFormBody() throws IOException {
        String body = "note=" + "a".repeat(100) + "&tag=last";
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/notes/");
        request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        request.setQueryString("page=2");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, 16);

        assertThat(cached.getParameter("tag")).isEqualTo("last");
        assertThat(cached.getParameter("page")).isEqualTo("2");
        assertThat(cached.getParameter("note")).hasSize(100);
        assertThat(StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8)).isEqualTo(body);
    }

    private static HttpServletRequestWrapper streaming(MockHttpServletRequest request, ByteArrayInputStream source) {
        return new HttpServletRequestWrapper(request) {
            @Override
            public ServletInputStream getInputStream() {
                return new ServletInputStream() {
                    @Override
                    public boolean isFinished() {
                        return source.available() == 0;
                    }

                    @Override
                    public boolean isReady() {
                        return true;
                    }

                    @Override
                    public void setReadListener(ReadListener listener) {
                        throw new UnsupportedOperationException();
                    }

                    @Override
                    public int read() {
                        return source.read();
                    }

                    @Override
                    public int read(byte[] b, int off, int len) {
                        return source.read(b, off, len);
                    }
                };
            }
        };
    }
}
