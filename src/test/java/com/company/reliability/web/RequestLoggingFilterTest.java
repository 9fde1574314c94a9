package com.company.reliability.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    @DisplayName("Should propagate the caller's request ID into the MDC and response")
    void shouldPropagateRequestId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/gates/check");
        request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "pipeline-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> seenInChain.set(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID_KEY));

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertThat(seenInChain.get()).isEqualTo("pipeline-42");
        assertThat(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER)).isEqualTo("pipeline-42");
        assertThat(MDC.get(RequestLoggingFilter.MDC_REQUEST_ID_KEY)).isNull();
    }

    @Test
    @DisplayName("Should tag a gate check with its operation while the chain runs")
    void shouldTagOperation() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/gates/check");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        filter.doFilter(request, response,
                (req, res) -> seenInChain.set(MDC.get(RequestLoggingFilter.MDC_OPERATION_KEY)));

        assertThat(seenInChain.get()).isEqualTo("gate-check");
        assertThat(MDC.get(RequestLoggingFilter.MDC_OPERATION_KEY)).isNull();
    }

    @ParameterizedTest(name = "{0} {1} is {2}")
    @CsvSource({
            "POST, /api/v1/gates/check, gate-check",
            "POST, /api/v1/deployments/webhooks/argocd, webhook-argocd",
            "POST, /api/v1/deployments/webhooks/github, webhook-github",
            "POST, /api/v1/deployments, deployment-record",
            "POST, /api/v1/deployments/abc123/correlate, deployment-correlate",
            "POST, /api/v1/drift/analyze, api",
            "GET, /api/v1/gates/check, api",
            "GET, /api/v1/health, api"
    })
    void shouldNameOperations(String method, String uri, String expected) {
        assertThat(RequestLoggingFilter.operationFor(method, uri)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should generate a request ID when the header is missing")
    void shouldGenerateRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER)).isNotBlank();
    }
}
