package com.sqlguard.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the request trace id, and the tool name for tool calls, into the MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_TOOL = "tool";

    private static final String TOOLS_PATH = "/v1/tools/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            String tool = toolName(httpServletRequest.getRequestURI());
            if (tool != null) {
                MDC.put(MDC_TOOL, tool);
            }

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_TOOL);
        }
    }

    static String toolName(String uri) {
        if (uri == null) {
            return null;
        }
        int idx = uri.indexOf(TOOLS_PATH);
        if (idx < 0) {
            return null;
        }
        String tool = uri.substring(idx + TOOLS_PATH.length());
        int slash = tool.indexOf('/');
        if (slash >= 0) {
            tool = tool.substring(0, slash);
        }
        return tool.isEmpty() ? null : tool;
    }
}
