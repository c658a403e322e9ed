package com.jasmin.requestguard.extractors;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.SequenceInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads at most {@code maxBytes + 1} bytes of the request body up front so they can be scanned,
 * then hands the application that prefix followed by the unread rest of the original stream.
 * Form parameters are served from the cached body because the container can no longer parse it.
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private byte[] cachedBody;
    private InputStream remainder;
    private ServletInputStream handedOut;
    private Map<String, String[]> parameters;

    public CachedBodyHttpServletRequest(HttpServletRequest request, int maxBytes) throws IOException {
        super(request);
        InputStream in = request.getInputStream();
        int limit = (int) Math.min((long) maxBytes + 1, Integer.MAX_VALUE);
        this.cachedBody = in.readNBytes(limit);
        // a short read means the whole body is in memory
        this.remainder = cachedBody.length < limit ? null : in;
    }

    /** The buffered prefix of the body; longer than the bound only when the body exceeds it. */
    public byte[] getCachedBody() {
        return cachedBody;
    }

    /** {@code true} when the whole body is buffered and can be replayed any number of times. */
    public boolean isFullyCached() {
        return remainder == null;
    }

    @Override
    public ServletInputStream getInputStream() {
        if (remainder == null) {
            return new CachedBodyServletInputStream(new ByteArrayInputStream(cachedBody));
        }
        // the original stream can be consumed once, every caller shares that single pass
        if (handedOut == null) {
            handedOut = new CachedBodyServletInputStream(
                    new SequenceInputStream(new ByteArrayInputStream(cachedBody), remainder));
        }
        return handedOut;
    }

    @Override
    public BufferedReader getReader() {
        return new BufferedReader(new InputStreamReader(getInputStream(), charset()));
    }

    @Override
    public String getParameter(String name) {
        String[] values = getParameterMap().get(name);
        return (values == null || values.length == 0) ? null : values[0];
    }

    @Override
    public String[] getParameterValues(String name) {
        return getParameterMap().get(name);
    }

    @Override
    public Enumeration<String> getParameterNames() {
        return Collections.enumeration(getParameterMap().keySet());
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        if (parameters == null) {
            Map<String, List<String>> merged = new LinkedHashMap<>(UrlEncodedParser.parse(getQueryString()));
            if (isFormBody()) {
                bufferRemainder();
                UrlEncodedParser.parse(new String(cachedBody, charset()))
                        .forEach((k, v) -> merged.merge(k, v, (a, b) -> {
                            List<String> all = new ArrayList<>(a);
                            all.addAll(b);
                            return all;
                        }));
            }
            Map<String, String[]> result = new LinkedHashMap<>();
            merged.forEach((k, v) -> result.put(k, v.toArray(new String[0])));
            parameters = Collections.unmodifiableMap(result);
        }
        return parameters;
    }

    private void bufferRemainder() {
        if (remainder == null || handedOut != null) {
            return;
        }
        try {
            byte[] rest = StreamUtils.copyToByteArray(remainder);
            byte[] full = Arrays.copyOf(cachedBody, cachedBody.length + rest.length);
            System.arraycopy(rest, 0, full, cachedBody.length, rest.length);
            cachedBody = full;
            remainder = null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read form body", e);
        }
    }

    private boolean isFormBody() {
        String contentType = getContentType();
        if (contentType == null) return false;
        try {
            return MediaType.APPLICATION_FORM_URLENCODED.includes(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Charset charset() {
        String encoding = getCharacterEncoding();
        if (encoding == null) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static final class CachedBodyServletInputStream extends ServletInputStream {
        private final InputStream in;
        private boolean finished;

        private CachedBodyServletInputStream(InputStream in) {
            this.in = in;
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener listener) {
            throw new UnsupportedOperationException("Async reads are not supported on a cached body");
        }

        @Override
        public int read() throws IOException {
            int b = in.read();
            if (b < 0) finished = true;
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = in.read(b, off, len);
            if (n < 0) finished = true;
            return n;
        }
    }
}
