package com.shelfkeep.loanservice.infrastructure.web;

import com.shelfkeep.observability.CorrelationContext;
import com.shelfkeep.observability.CorrelationContextHolder;
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
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept; otherwise a UUID is generated. The ID is
 * bound to {@link CorrelationContextHolder} (and so to the MDC) for the duration of the request
 * and echoed in the response. {@link ActorContextArgumentResolver} later adds the tenant and
 * member of the verified actor.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so every later filter and handler logs with it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // servlet threads are pooled
            CorrelationContextHolder.clear();
        }
    }
}
