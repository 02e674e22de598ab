package com.phillippitts.scriptmonitor.config.logging;

import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.reference.ReferenceScriptService;
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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private ScriptAlignmentEngine engine;
    private ReferenceScriptService referenceService;
    private MdcFilter filter;
    private MockHttpServletResponse response;
    private final Map<String, String> seen = new HashMap<>();
    private final FilterChain capturingChain = (req, res) -> seen.putAll(ThreadContext.getContext());

    @BeforeEach
    void setUp() {
        engine = mock(ScriptAlignmentEngine.class);
        referenceService = mock(ReferenceScriptService.class);
        when(engine.getAlignerName()).thenReturn("sequential");
        filter = new MdcFilter(engine, referenceService);
        response = new MockHttpServletResponse();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private static MockHttpServletRequest request(String method, String uri) {
        return new MockHttpServletRequest(method, uri);
    }

    @Test
    void tagsRequestWithIdMethodAndUri() throws ServletException, IOException {
        MockHttpServletRequest req = request("PUT", "/api/monitor/reference");
        req.addHeader("X-Request-ID", "req-xyz");

        filter.doFilter(req, response, capturingChain);

        assertThat(seen)
                .containsEntry("requestId", "req-xyz")
                .containsEntry("method", "PUT")
                .containsEntry("uri", "/api/monitor/reference");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-xyz");
    }

    @Test
    void generatesRequestIdWhenHeaderBlank() throws ServletException, IOException {
        MockHttpServletRequest req = request("POST", "/api/monitor/reset");
        req.addHeader("X-Request-ID", "   ");

        filter.doFilter(req, response, capturingChain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }

    @Test
    void tagsActiveAlignerAndLoadedReferenceLength() throws ServletException, IOException {
        when(engine.getAlignerName()).thenReturn("optimal");
        when(referenceService.isLoaded()).thenReturn(true);
        when(referenceService.current()).thenReturn("오늘 날씨가");

        filter.doFilter(request("GET", "/api/monitor/score"), response, capturingChain);

        assertThat(seen)
                .containsEntry("aligner", "optimal")
                .containsEntry("reference", "loaded:6");
    }

    @Test
    void tagsMissingReferenceAsNone() throws ServletException, IOException {
        when(referenceService.isLoaded()).thenReturn(false);

        filter.doFilter(request("GET", "/api/monitor/status"), response, capturingChain);

        assertThat(seen)
                .containsEntry("aligner", "sequential")
                .containsEntry("reference", "none");
    }

    @Test
    void leavesNonApiPathsUntagged() throws ServletException, IOException {
        filter.doFilter(request("GET", "/actuator/health"), response, capturingChain);

        assertThat(seen).doesNotContainKeys("requestId", "aligner", "reference");
        assertThat(response.getHeader("X-Request-ID")).isNull();
    }

    @Test
    void clearsContextEvenWhenChainThrows() {
        FilterChain failing = (req, res) -> {
            throw new ServletException("Test exception");
        };

        assertThatThrownBy(() -> filter.doFilter(request("POST", "/api/monitor/score"), response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void referenceStateFollowsReloadsBetweenRequests() throws ServletException, IOException {
        when(referenceService.isLoaded()).thenReturn(false);
        filter.doFilter(request("GET", "/api/monitor/status"), response, capturingChain);
        assertThat(seen).containsEntry("reference", "none");
        assertThat(ThreadContext.get("reference")).isNull();

        when(referenceService.isLoaded()).thenReturn(true);
        when(referenceService.current()).thenReturn("대본");
        filter.doFilter(request("GET", "/api/monitor/status"), new MockHttpServletResponse(), capturingChain);

        assertThat(seen).containsEntry("reference", "loaded:2");
    }
}
