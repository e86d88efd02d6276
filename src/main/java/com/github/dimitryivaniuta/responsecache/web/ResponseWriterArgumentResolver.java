package com.github.dimitryivaniuta.responsecache.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies {@link ResponseWriter} handler parameters.
 *
 * <p>Uses the writer published by {@link ResponseCacheFilter}; without the filter a plain
 * {@link ServletResponseWriter} is created. Like an {@code HttpServletResponse} parameter, declaring a
 * writer tells MVC the handler produces the response itself.
 */
public class ResponseWriterArgumentResolver implements HandlerMethodArgumentResolver {

    private final ObjectMapper mapper;

    public ResponseWriterArgumentResolver(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ResponseWriter.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        if (mavContainer != null) {
            mavContainer.setRequestHandled(true);
        }

        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request != null && request.getAttribute(ResponseWriter.ATTRIBUTE) instanceof ResponseWriter writer) {
            return writer;
        }

        HttpServletResponse response = webRequest.getNativeResponse(HttpServletResponse.class);
        if (response == null) {
            throw new IllegalStateException("ResponseWriter requires a servlet response");
        }
        return new ServletResponseWriter(response, mapper);
    }
}
