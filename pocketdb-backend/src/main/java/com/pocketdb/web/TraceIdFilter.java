package com.pocketdb.web;

import com.pocketdb.model.BackendKind;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Tags every request with a trace id and, for backend routes, the backend kind it addresses.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_BACKEND = "backend";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = UUID.randomUUID().toString();
            }

            MDC.put(MDC_TRACE_ID, traceId);
            backendOf(httpServletRequest.getRequestURI())
                    .ifPresent(kind -> MDC.put(MDC_BACKEND, kind.path()));
            log.debug("{} {}", httpServletRequest.getMethod(), httpServletRequest.getRequestURI());

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_BACKEND);
        }
    }

    /**
     * /v1/connections/{kind}/..., /v1/sql/{kind}/..., /v1/redis/... and /v1/mongo/...
     */
    static Optional<BackendKind> backendOf(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        String[] segments = uri.split("/");
        // segments[0] is the empty string before the leading slash
        if (segments.length < 3 || !"v1".equals(segments[1])) {
            return Optional.empty();
        }
        switch (segments[2]) {
            case "connections":
            case "sql":
                return segments.length > 3 ? BackendKind.lookup(segments[3]) : Optional.empty();
            case "redis":
                return Optional.of(BackendKind.REDIS);
            case "mongo":
                return Optional.of(BackendKind.MONGO);
            default:
                return Optional.empty();
        }
    }
}
