package com.github.dimitryivaniuta.responsecache.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link ResponseWriter} writing straight to the servlet response.
 */
public final class ServletResponseWriter implements ResponseWriter {

    private final HttpServletResponse response;
    private final ObjectMapper mapper;

    public ServletResponseWriter(HttpServletResponse response, ObjectMapper mapper) {
        this.response = response;
        this.mapper = mapper;
    }

    @Override
    public ResponseWriter status(int code) {
        response.setStatus(code);
        return this;
    }

    @Override
    public ResponseWriter header(String name, String value) {
        response.setHeader(name, value);
        return this;
    }

    @Override
    public ResponseWriter headers(Map<String, String> headers) {
        if (headers != null) headers.forEach(response::setHeader);
        return this;
    }

    @Override
    public ResponseWriter attachment(String filename) {
        ContentDisposition.Builder disposition = ContentDisposition.attachment();
        if (filename != null && !filename.isBlank()) {
            disposition.filename(filename);
            MediaTypeFactory.getMediaType(filename)
                    .ifPresent(type -> response.setContentType(type.toString()));
        }
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, disposition.build().toString());
        return this;
    }

    @Override
    public void send(String body) throws IOException {
        if (response.getContentType() == null) {
            response.setContentType(MediaType.TEXT_HTML_VALUE);
        }
        write(body == null ? "" : body);
    }

    @Override
    public void json(Object body) throws IOException {
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        write(mapper.writeValueAsString(body));
    }

    private void write(String text) throws IOException {
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(text);
        response.flushBuffer();
    }
}
