package com.github.dimitryivaniuta.responsecache.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet entry point of the response cache.
 *
 * <p>Wraps the request so its body can be fingerprinted and still be read by the handler, creates the
 * {@link ServletResponseWriter} and lets {@link ResponseCacheHandler} decide. The filter chain is the
 * continuation; before it runs, the writer chosen for the request is published under
 * {@link ResponseWriter#ATTRIBUTE}.
 */
public class ResponseCacheFilter extends OncePerRequestFilter {

    private final ResponseCacheHandler handler;
    private final ObjectMapper mapper;

    public ResponseCacheFilter(ResponseCacheHandler handler, ObjectMapper mapper) {
        this.handler = handler;
        this.mapper = mapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        CachedBodyRequest wrapped = new CachedBodyRequest(request);
        ResponseWriter writer = new ServletResponseWriter(response, mapper);

        handler.handle(wrapped, writer, active -> {
            wrapped.setAttribute(ResponseWriter.ATTRIBUTE, active);
            filterChain.doFilter(wrapped, response);
        });
    }
}
