package com.phillippitts.scriptmonitor.config.logging;

import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.reference.ReferenceScriptService;
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
 * Tags every monitor API call with a request id and the scoring context it ran against.
 *
 * <p>ThreadContext keys:</p>
 * <ul>
 *   <li>requestId: X-Request-ID header or a generated UUID, echoed back on the response</li>
 *   <li>method, uri</li>
 *   <li>aligner: active alignment strategy</li>
 *   <li>reference: {@code loaded:<chars>} or {@code none}, as seen when the request arrived</li>
 * </ul>
 *
 * <p>Only {@code /api/} paths are tagged. Socket connections carry {@code connectionId} and
 * {@code remote} instead, set by the monitor server.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String API_PREFIX = "/api/";

    private final ScriptAlignmentEngine engine;
    private final ReferenceScriptService referenceService;

    public MdcFilter(ScriptAlignmentEngine engine, ReferenceScriptService referenceService) {
        this.engine = engine;
        this.referenceService = referenceService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri == null || !uri.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            ThreadContext.put("requestId", requestId);
            ThreadContext.put("method", request.getMethod());
            ThreadContext.put("uri", request.getRequestURI());
            ThreadContext.put("aligner", engine.getAlignerName());
            ThreadContext.put("reference", referenceState());
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private String referenceState() {
        return referenceService.isLoaded() ? "loaded:" + referenceService.current().length() : "none";
    }
}
