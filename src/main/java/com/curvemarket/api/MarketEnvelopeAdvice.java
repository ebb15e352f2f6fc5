package com.curvemarket.api;

import com.curvemarket.api.dto.response.MarketEnvelope;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps what the market controllers return in a {@link MarketEnvelope}. Limited to the
 * controller package, so actuator and error endpoints keep their own bodies.
 */
@RestControllerAdvice(basePackages = "com.curvemarket.api.controller")
public class MarketEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    private final MarketEnvelopes envelopes;

    public MarketEnvelopeAdvice(MarketEnvelopes envelopes) {
        this.envelopes = envelopes;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof MarketEnvelope<?>) {
            return body;
        }
        return envelopes.ok(body);
    }
}
