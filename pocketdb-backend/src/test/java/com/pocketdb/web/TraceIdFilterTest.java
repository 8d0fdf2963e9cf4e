package com.pocketdb.web;

import com.pocketdb.model.BackendKind;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void doFilter_tagsTraceAndBackendThenClears() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/sql/postgresql/tables");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.put("trace", MDC.get(TraceIdFilter.MDC_TRACE_ID));
            seen.put("backend", MDC.get(TraceIdFilter.MDC_BACKEND));
        });

        assertEquals("req-42", seen.get("trace"));
        assertEquals("postgres", seen.get("backend"));
        assertEquals("req-42", response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertNull(MDC.get(TraceIdFilter.MDC_TRACE_ID));
        assertNull(MDC.get(TraceIdFilter.MDC_BACKEND));
    }

    @Test
    void doFilter_nonBackendRouteHasNoBackendTag() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.put("backend", MDC.get(TraceIdFilter.MDC_BACKEND)));

        assertNull(seen.get("backend"));
    }

    @Test
    void backendOf_resolvesEachRouteFamily() {
        assertEquals(Optional.of(BackendKind.MYSQL), TraceIdFilter.backendOf("/v1/connections/mysql"));
        assertEquals(Optional.of(BackendKind.SQLITE), TraceIdFilter.backendOf("/v1/sql/sqlite/tables/t/rows"));
        assertEquals(Optional.of(BackendKind.REDIS), TraceIdFilter.backendOf("/v1/redis/keys/a"));
        assertEquals(Optional.of(BackendKind.MONGO), TraceIdFilter.backendOf("/v1/mongo/databases"));
        assertEquals(Optional.empty(), TraceIdFilter.backendOf("/v1/sql/oracle/tables"));
        assertEquals(Optional.empty(), TraceIdFilter.backendOf("/v1/sql"));
        assertEquals(Optional.empty(), TraceIdFilter.backendOf("/"));
    }
}
