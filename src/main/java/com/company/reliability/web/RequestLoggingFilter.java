package com.company.reliability.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a request ID and the engine operation in the MDC and echoes the ID
 * back, so gate decisions and webhook recordings can be traced to the
 * calling pipeline run. Pipeline-facing calls are logged at info.
 */
@Component
@Slf4j
public class RequestLoggingFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID_KEY = "requestId";
    static final String MDC_OPERATION_KEY = "operation";

    private static final String GATE_CHECK_PATH = "/api/v1/gates/check";
    private static final String WEBHOOK_PREFIX = "/api/v1/deployments/webhooks/";
    private static final String DEPLOYMENTS_PATH = "/api/v1/deployments";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isEmpty()) {
            requestId = UUID.randomUUID().toString();
        }
        String operation = operationFor(httpRequest.getMethod(), httpRequest.getRequestURI());

        MDC.put(MDC_REQUEST_ID_KEY, requestId);
        MDC.put(MDC_OPERATION_KEY, operation);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        long start = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            if (isPipelineFacing(operation)) {
                log.info("{} answered {} in {}ms", operation, httpResponse.getStatus(), elapsed);
            } else {
                log.debug("{} {} -> {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), elapsed);
            }
            MDC.remove(MDC_OPERATION_KEY);
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    /**
     * Names the engine operation behind a request, e.g. {@code gate-check}
     * or {@code webhook-argocd}; {@code api} for everything else.
     */
    static String operationFor(String method, String uri) {
        if (uri == null || !"POST".equalsIgnoreCase(method)) {
            return "api";
        }
        if (uri.equals(GATE_CHECK_PATH)) {
            return "gate-check";
        }
        if (uri.startsWith(WEBHOOK_PREFIX) && uri.length() > WEBHOOK_PREFIX.length()) {
            return "webhook-" + uri.substring(WEBHOOK_PREFIX.length());
        }
        if (uri.equals(DEPLOYMENTS_PATH)) {
            return "deployment-record";
        }
        if (uri.startsWith(DEPLOYMENTS_PATH + "/") && uri.endsWith("/correlate")) {
            return "deployment-correlate";
        }
        return "api";
    }

    private static boolean isPipelineFacing(String operation) {
        return operation.equals("gate-check") || operation.startsWith("webhook-") || operation.equals("deployment-record");
    }
}
