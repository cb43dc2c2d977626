package com.flagship.license_fulfillment.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Opens a correlation scope per request. The id comes from
 * {@code X-Correlation-ID} when the chat layer sends one and is echoed back;
 * GET lookups that name a user through {@code ?userId=} are tagged with it too.
 * Provider webhooks never carry the header, so each delivery gets a fresh id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final String USER_ID_PARAM = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(correlationId);
        String id = CorrelationContext.getCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, id);
        if ("GET".equals(request.getMethod())) {
            // reading parameters on a POST could consume a form body before the webhook sees it
            CorrelationContext.tagPayment(null, request.getParameter(USER_ID_PARAM));
        }
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, id);
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") || path.equals("/health");
    }
}
