package com.phillippitts.leaderkey.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every API request in Log4j2's ThreadContext so store and navigation log lines can be
 * traced back to the caller.
 *
 * <p>Keys: {@code requestId} (X-Request-ID header or a fresh UUID, echoed back on the
 * response), {@code client} (X-Client header, e.g. the menu UI or a script) and
 * {@code endpoint} ("METHOD /uri"). The config executors copy the context onto worker
 * threads, so a save triggered by a request logs the same requestId.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_HEADER = "X-Client";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ThreadContext.put("requestId", requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String client = request.getHeader(CLIENT_HEADER);
        if (client != null && !client.isBlank()) {
            ThreadContext.put("client", client.strip());
        }
        ThreadContext.put("endpoint", request.getMethod() + " " + request.getRequestURI());
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearMap();
        }
    }
}
