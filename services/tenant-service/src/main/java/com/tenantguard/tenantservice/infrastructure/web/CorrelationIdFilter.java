package com.tenantguard.tenantservice.infrastructure.web;

import com.tenantguard.observability.CorrelationContext;
import com.tenantguard.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID from {@code X-Correlation-ID} (or a fresh UUID) and the caller from {@code X-User-Id}
 * are bound to {@link CorrelationContextHolder}, and through it to the SLF4J MDC, for the whole
 * request. The correlation ID is echoed on the response.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String USER_ID_HEADER = "X-User-Id";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String userId = request.getHeader(USER_ID_HEADER);

        var context = new CorrelationContext(correlationId, null, blankToNull(userId), UUID.randomUUID().toString());
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads.
            CorrelationContextHolder.clear();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
