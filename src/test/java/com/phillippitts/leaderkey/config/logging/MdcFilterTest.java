package com.phillippitts.leaderkey.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcFilterTest {

    private final MdcFilter filter = new MdcFilter();
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @BeforeEach
    void setUp() {
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void tagsContextDuringChainAndEchoesRequestId() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/navigation/keys");
        request.addHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
        request.addHeader(MdcFilter.CLIENT_HEADER, " menu ");
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.putAll(ThreadContext.getImmutableContext());

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-123")
                .containsEntry("client", "menu")
                .containsEntry("endpoint", "POST /api/navigation/keys");
        assertThat(response.getHeader(MdcFilter.REQUEST_ID_HEADER)).isEqualTo("req-123");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesRequestIdWhenHeaderIsBlank() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/config");
        request.addHeader(MdcFilter.REQUEST_ID_HEADER, "  ");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> seen.putAll(ThreadContext.getImmutableContext()));

        assertThat(seen.get("requestId"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(seen).doesNotContainKey("client");
        assertThat(response.getHeader(MdcFilter.REQUEST_ID_HEADER)).isEqualTo(seen.get("requestId"));
    }

    @Test
    void clearsContextEvenWhenChainThrows() {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/api/config");
        request.addHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
        FilterChain failing = (req, res) -> {
            throw new ServletException("Test exception");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("endpoint")).isNull();
    }
}
