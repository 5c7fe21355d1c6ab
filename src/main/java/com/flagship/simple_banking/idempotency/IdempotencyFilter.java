package com.flagship.simple_banking.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.simple_banking.exception.ApiError;
import com.flagship.simple_banking.observability.CorrelationContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * HTTP adapter for {@link IdempotencyCoordinator}.
 *
 * Requests with a naturally idempotent method (GET, HEAD, OPTIONS) or without
 * a key pass straight through. Otherwise the rest of the chain runs inside the
 * coordinator with the response buffered, so the exact status and body can be
 * cached and replayed to duplicates.
 *
 * Responses carry {@code X-Idempotency-Status}: {@code new} when the handler
 * ran, {@code replayed} when the cached response was served.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
@Slf4j
public class IdempotencyFilter extends OncePerRequestFilter {

    static final String STATUS_HEADER = "X-Idempotency-Status";
    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final IdempotencyProperties properties;
    private final IdempotencyCoordinator coordinator;
    private final ObjectMapper objectMapper;

    public IdempotencyFilter(
            IdempotencyProperties properties,
            IdempotencyCoordinator coordinator,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!properties.isEnabled() || isSafeMethod(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        String idempotencyKey = request.getHeader(properties.getHeaderName());
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        MDC.put(CorrelationContext.IDEMPOTENCY_KEY_MDC_KEY, idempotencyKey);
        try {
            filterIdempotent(idempotencyKey, request, response, filterChain);
        } finally {
            MDC.remove(CorrelationContext.IDEMPOTENCY_KEY_MDC_KEY);
        }
    }

    private void filterIdempotent(
            String idempotencyKey, HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        IdempotentResult result;
        try {
            result = coordinator.execute(idempotencyKey, () -> {
                responseWrapper.setHeader(STATUS_HEADER, "new");
                filterChain.doFilter(request, responseWrapper);
                return capture(responseWrapper);
            });
        } catch (IdempotencyKeyInProgressException ex) {
            log.warn("Gave up waiting for idempotency key: {}", ex.getMessage());
            writeError(response, ex);
            return;
        } catch (ServletException | IOException | RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new ServletException(ex);
        }

        if (result.isReplayed()) {
            replay(result.getResponse(), response);
        } else {
            responseWrapper.copyBodyToResponse();
        }
    }

    private CapturedResponse capture(ContentCachingResponseWrapper response) {
        return new CapturedResponse(
            response.getStatus(),
            response.getContentType(),
            response.getContentAsByteArray());
    }

    private void replay(CapturedResponse cached, HttpServletResponse response) throws IOException {
        response.setStatus(cached.getStatus());
        response.setHeader(STATUS_HEADER, "replayed");
        if (cached.getContentType() != null) {
            response.setContentType(cached.getContentType());
        }
        byte[] body = cached.getBody();
        if (body != null && body.length > 0) {
            response.setContentLength(body.length);
            response.getOutputStream().write(body);
        }
        response.flushBuffer();
    }

    private void writeError(HttpServletResponse response, IdempotencyKeyInProgressException ex)
            throws IOException {
        response.setStatus(ex.getCategory().getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(STATUS_HEADER, "in_progress");
        objectMapper.writeValue(response.getWriter(), ApiError.of(ex.getCode(), ex.getMessage()));
    }

    private static boolean isSafeMethod(String method) {
        return method != null && SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }
}
