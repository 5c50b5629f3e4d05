package com.gymadmin.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void wellFormedClientIdIsReused() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/permissions");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "desk-7.req_001");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)));

        assertThat(seenInMdc.get()).isEqualTo("desk-7.req_001");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("desk-7.req_001");
        assertThat(request.getAttribute(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("desk-7.req_001");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void unsafeClientIdIsReplaced() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc\r\nX-Injected: 1");

        String requestId = RequestIdFilter.resolveRequestId(request);

        assertThat(requestId).doesNotContain("\n").hasSize(36);
    }

    @Test
    void overlongClientIdIsReplaced() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "a".repeat(65));

        assertThat(RequestIdFilter.resolveRequestId(request)).hasSize(36);
    }
}
