package com.pocketdb.controller;

import com.pocketdb.api.ConnectRequest;
import com.pocketdb.model.BackendKind;
import com.pocketdb.redis.RedisService;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.NotConnectedException;
import com.pocketdb.service.ConnectFailedException;
import com.pocketdb.service.ConnectTimeoutException;
import com.pocketdb.service.ConnectionService;
import com.pocketdb.sql.SqlAdapters;
import com.pocketdb.sql.SqliteAdapter;
import com.pocketdb.tunnel.AuthUnsupportedException;
import com.pocketdb.web.GlobalExceptionHandler;
import com.pocketdb.web.TraceIdFilter;
import io.lettuce.core.RedisCommandExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class GatewayControllerTest {

    private ConnectionService connectionService;
    private RedisService redisService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        connectionService = mock(ConnectionService.class);
        redisService = mock(RedisService.class);
        SqlAdapters adapters = new SqlAdapters(List.of(new SqliteAdapter(new ConnectionRegistry(), "utf8")));

        mvc = MockMvcBuilders.standaloneSetup(
                        new ConnectionController(connectionService),
                        new SqlController(adapters, 1000),
                        new RedisController(redisService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @Test
    void sqlOperationWithoutConnection_returnsNotConnected() throws Exception {
        mvc.perform(get("/v1/sql/sqlite/tables").header(TraceIdFilter.TRACE_ID_HEADER, "trace-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_CONNECTED"))
                .andExpect(jsonPath("$.message").value("Not connected: sqlite"))
                .andExpect(jsonPath("$.traceId").value("trace-1"))
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "trace-1"));
    }

    @Test
    void missingRequestId_generatesOne() throws Exception {
        mvc.perform(get("/v1/sql/sqlite/tables"))
                .andExpect(status().isConflict())
                .andExpect(header().exists(TraceIdFilter.TRACE_ID_HEADER))
                .andExpect(jsonPath("$.traceId").isNotEmpty());
    }

    @Test
    void serverOnlyOperationOnSqlite_isUnsupported() throws Exception {
        mvc.perform(get("/v1/sql/sqlite/views"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_OPERATION"));
    }

    @Test
    void unknownBackendKind_isInvalidArgument() throws Exception {
        mvc.perform(get("/v1/sql/oracle/tables"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void connectTimeout_mapsToGatewayTimeout() throws Exception {
        when(connectionService.connect(eq(BackendKind.MYSQL), any(ConnectRequest.class)))
                .thenThrow(new ConnectTimeoutException(BackendKind.MYSQL, 5000));

        mvc.perform(post("/v1/connections/mysql").contentType(MediaType.APPLICATION_JSON).content("{\"host\":\"db\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("CONNECT_TIMEOUT"));
    }

    @Test
    void connectFailure_mapsToConnectionFailed() throws Exception {
        when(connectionService.connect(eq(BackendKind.POSTGRES), any(ConnectRequest.class)))
                .thenThrow(new ConnectFailedException(BackendKind.POSTGRES, "password authentication failed", null));

        mvc.perform(post("/v1/connections/pg").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONNECTION_FAILED"))
                .andExpect(jsonPath("$.message").value("Failed to connect to postgres: password authentication failed"));
    }

    @Test
    void keyOnlyTunnelLogin_mapsToAuthUnsupported() throws Exception {
        when(connectionService.connect(eq(BackendKind.REDIS), any(ConnectRequest.class)))
                .thenThrow(new AuthUnsupportedException("Only password authentication is supported for SSH tunnels"));

        mvc.perform(post("/v1/connections/redis").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ssh\":{\"host\":\"bastion\",\"username\":\"ops\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("AUTH_UNSUPPORTED"));
    }

    @Test
    void invalidSshOptions_failValidation() throws Exception {
        mvc.perform(post("/v1/connections/redis").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ssh\":{\"host\":\"\",\"username\":\"ops\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verifyNoInteractions(connectionService);
    }

    @Test
    void redisCommandError_mapsToQueryError() throws Exception {
        when(redisService.executeRaw("NOPE")).thenThrow(new RedisCommandExecutionException("ERR unknown command 'NOPE'"));

        mvc.perform(post("/v1/redis/execute").contentType(MediaType.APPLICATION_JSON).content("{\"command\":\"NOPE\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("QUERY_ERROR"))
                .andExpect(jsonPath("$.message").value("ERR unknown command 'NOPE'"));
    }

    @Test
    void redisRead_returnsValueText() throws Exception {
        when(redisService.getValue("greeting")).thenReturn("hello");

        mvc.perform(get("/v1/redis/keys/greeting"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("hello"));
    }

    @Test
    void redisRead_notConnected() throws Exception {
        when(redisService.getValue(anyString())).thenThrow(new NotConnectedException(BackendKind.REDIS));

        mvc.perform(get("/v1/redis/keys/greeting"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_CONNECTED"));
    }
}
