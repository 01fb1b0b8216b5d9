package com.paywise.budget.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a trace id and, for the analysis endpoints, the {@code asOf}
 * reference date, so log lines of one analysis run can be correlated.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_HEADER = "X-Request-Trace";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_AS_OF = "as_of";

    // caller-supplied ids end up in log lines and response headers
    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        String asOf = request.getParameter("asOf");
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, request.getRequestURI()));
        MDC.put(MDC_TRACE_ID, traceId);
        if (asOf != null && !asOf.isBlank()) {
            MDC.put(MDC_AS_OF, asOf);
        }
        response.setHeader(TRACE_HEADER, traceId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_AS_OF);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String header) {
        if (header != null && SAFE_TRACE_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
