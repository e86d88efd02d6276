package com.github.dimitryivaniuta.responsecache.web;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request wrapper that buffers the body on first call to {@link #body()} and replays it to downstream readers.
 *
 * <p>Until {@link #body()} is called the wrapper is a plain pass-through, so requests that never get
 * fingerprinted (or whose body is not used for the key) are not buffered.
 *
 * <p>Once a form-encoded body is buffered the container can no longer parse it, so the parameter
 * methods then answer from the query string followed by the buffered form fields.
 */
public final class CachedBodyRequest extends HttpServletRequestWrapper {

    private static final FormHttpMessageConverter FORM_READER = new FormHttpMessageConverter();

    private byte[] body;
    private Map<String, String[]> parameters;

    public CachedBodyRequest(HttpServletRequest request) {
        super(request);
    }

    public byte[] body() throws IOException {
        if (body == null) {
            body = StreamUtils.copyToByteArray(super.getInputStream());
        }
        return body;
    }

    public boolean isFormContent() {
        String contentType = getContentType();
        if (contentType == null || contentType.isBlank()) return false;
        try {
            return MediaType.APPLICATION_FORM_URLENCODED.includes(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }

    /** Form fields of the body in received order; empty unless the body is form-encoded. */
    public MultiValueMap<String, String> formFields() throws IOException {
        if (!isFormContent()) return new LinkedMultiValueMap<>();
        return readForm(body(), charset());
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (body == null) return super.getInputStream();
        return new ReplayInputStream(body);
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (body == null) return super.getReader();
        return new BufferedReader(new InputStreamReader(getInputStream(), charset()));
    }

    @Override
    public String getParameter(String name) {
        Map<String, String[]> params = bufferedFormParameters();
        if (params == null) return super.getParameter(name);
        String[] values = params.get(name);
        return (values == null || values.length == 0) ? null : values[0];
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        Map<String, String[]> params = bufferedFormParameters();
        return (params == null) ? super.getParameterMap() : params;
    }

    @Override
    public Enumeration<String> getParameterNames() {
        Map<String, String[]> params = bufferedFormParameters();
        return (params == null) ? super.getParameterNames() : Collections.enumeration(params.keySet());
    }

    @Override
    public String[] getParameterValues(String name) {
        Map<String, String[]> params = bufferedFormParameters();
        if (params == null) return super.getParameterValues(name);
        String[] values = params.get(name);
        return (values == null) ? null : values.clone();
    }

    /** Null while the container still owns parameter parsing. */
    private Map<String, String[]> bufferedFormParameters() {
        if (body == null || !isFormContent()) return null;
        if (parameters == null) {
            MultiValueMap<String, String> merged = new LinkedMultiValueMap<>();
            try {
                String query = getQueryString();
                if (query != null && !query.isEmpty()) {
                    merged.addAll(readForm(query.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
                }
                merged.addAll(readForm(body, charset()));
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to parse buffered form body", e);
            }
            Map<String, String[]> out = new LinkedHashMap<>();
            merged.forEach((name, values) -> out.put(name, values.toArray(new String[0])));
            parameters = Collections.unmodifiableMap(out);
        }
        return parameters;
    }

    private static MultiValueMap<String, String> readForm(byte[] bytes, Charset charset) throws IOException {
        HttpInputMessage message = new HttpInputMessage() {
            @Override
            public InputStream getBody() {
                return new ByteArrayInputStream(bytes);
            }

            @Override
            public HttpHeaders getHeaders() {
                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(new MediaType(MediaType.APPLICATION_FORM_URLENCODED, charset));
                return headers;
            }
        };
        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        // "flag" without "=" reads as a null value; servlet parameters report it as ""
        FORM_READER.read(null, message).forEach((name, values) ->
                values.forEach(value -> fields.add(name, value == null ? "" : value)));
        return fields;
    }

    private Charset charset() {
        String enc = getCharacterEncoding();
        if (enc == null) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(enc);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static final class ReplayInputStream extends ServletInputStream {

        private final ByteArrayInputStream in;

        ReplayInputStream(byte[] bytes) {
            this.in = new ByteArrayInputStream(bytes);
        }

        @Override
        public boolean isFinished() {
            return in.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener listener) {
            throw new UnsupportedOperationException("Non-blocking reads are not supported on a buffered body");
        }

        @Override
        public int read() {
            return in.read();
        }

        @Override
        public int read(byte[] b, int off, int len) {
            return in.read(b, off, len);
        }
    }
}
