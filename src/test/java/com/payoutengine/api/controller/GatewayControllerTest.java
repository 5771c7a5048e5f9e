package com.payoutengine.api.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.CacheInfo;
import com.payoutengine.gateway.CacheStats;
import com.payoutengine.gateway.CallOptions;
import com.payoutengine.gateway.ErrorKind;
import com.payoutengine.gateway.Gateway;
import com.payoutengine.gateway.GatewayError;
import com.payoutengine.gateway.GatewayResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web tests for the gateway endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GatewayControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private Gateway gateway;

    @Test
    void testCall_Success() throws Exception {
        when(gateway.call(eq(Layer.SANDBOX), eq("get_virtual_account"), any(), eq(CallOptions.DEFAULT)))
            .thenReturn(GatewayResponse.success(Layer.SANDBOX, "get_virtual_account",
                JsonNodeFactory.instance.objectNode().put("balance", 100),
                new CacheInfo(true, Instant.parse("2024-03-01T10:05:00Z"), 30L)));

        mockMvc.perform(post("/api/v1/gateway/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"layer\":\"pre\",\"method\":\"get_virtual_account\",\"params\":{\"virtual_account\":\"va-1\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.balance").value(100))
            .andExpect(jsonPath("$._cache.cached").value(true))
            .andExpect(jsonPath("$._cache.cache_age_seconds").value(30))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void testCall_DeferredIs429() throws Exception {
        when(gateway.call(any(), any(), any(), any())).thenReturn(GatewayResponse.failure(Layer.SANDBOX, "list_beneficiary",
            GatewayError.local(ErrorKind.RATE_LIMIT_DEFERRED, "Rate limit window is closed"),
            CacheInfo.fresh(Instant.parse("2024-03-01T10:05:00Z"))));

        mockMvc.perform(post("/api/v1/gateway/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"layer\":\"pre\",\"method\":\"list_beneficiary\"}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error.kind").value("RATE_LIMIT_DEFERRED"))
            .andExpect(jsonPath("$._cache.next_allowed_at").exists());
    }

    @Test
    void testCall_ForceAndLiveLayer() throws Exception {
        when(gateway.call(any(), any(), any(), any())).thenReturn(GatewayResponse.success(Layer.LIVE, "echo",
            JsonNodeFactory.instance.textNode("pong"), CacheInfo.fresh(null)));

        mockMvc.perform(post("/api/v1/gateway/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"layer\":\"prod\",\"method\":\"echo\",\"params\":{\"text\":\"ping\"},\"force\":true}"))
            .andExpect(status().isOk());

        verify(gateway).call(Layer.LIVE, "echo", Map.of("text", "ping"), CallOptions.forceRefresh());
    }

    @Test
    void testCall_InvalidLayer() throws Exception {
        mockMvc.perform(post("/api/v1/gateway/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"layer\":\"staging\",\"method\":\"echo\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid layer: staging. Must be \"pre\" or \"prod\""));

        verifyNoInteractions(gateway);
    }

    @Test
    void testCall_MissingMethod() throws Exception {
        mockMvc.perform(post("/api/v1/gateway/call")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"layer\":\"pre\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.method").value("Method is required"));
    }

    @Test
    void testMethods() throws Exception {
        mockMvc.perform(get("/api/v1/gateway/methods"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("activate_beneficiary"));
    }

    @Test
    void testCacheStats() throws Exception {
        when(gateway.cacheStats()).thenReturn(new CacheStats(3, 1, 2));

        mockMvc.perform(get("/api/v1/gateway/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hits").value(3))
            .andExpect(jsonPath("$.size").value(2));
    }

    @Test
    void testStatusOf() {
        assertEquals(HttpStatus.CONFLICT, GatewayController.statusOf(GatewayResponse.failure(
            Layer.SANDBOX, "x", GatewayError.local(ErrorKind.DUPLICATE_SUBMISSION, "dup"), CacheInfo.fresh(null))));
        assertEquals(HttpStatus.PRECONDITION_FAILED, GatewayController.statusOf(GatewayResponse.failure(
            Layer.SANDBOX, "x", GatewayError.local(ErrorKind.SIGNING, "no key"), CacheInfo.fresh(null))));
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, GatewayController.statusOf(GatewayResponse.failure(
            Layer.SANDBOX, "x", GatewayError.local(ErrorKind.TIMEOUT, "slow"), CacheInfo.fresh(null))));
        assertEquals(HttpStatus.BAD_GATEWAY, GatewayController.statusOf(GatewayResponse.failure(
            Layer.SANDBOX, "x", GatewayError.local(ErrorKind.REMOTE, "boom"), CacheInfo.fresh(null))));
    }
}
