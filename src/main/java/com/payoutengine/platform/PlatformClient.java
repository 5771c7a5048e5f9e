package com.payoutengine.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.CallOptions;
import com.payoutengine.gateway.Gateway;
import com.payoutengine.gateway.GatewayResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed platform operations used by the engine, all routed through the {@link Gateway}.
 *
 * Methods return the raw {@link GatewayResponse} so callers can branch on the
 * error kind; the {@code read*} helpers convert a successful result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformClient {

    public static final String TRANSFER_V2 = "transfer_between_virtual_accounts_v2";
    public static final String GET_TRANSFER = "get_virtual_accounts_transfer";

    private final Gateway gateway;
    private final ObjectMapper objectMapper;

    public GatewayResponse transfer(Layer layer, PlatformDTOs.TransferRequest request) {
        log.debug("Requesting transfer: layer={}, from={}, to={}, amount={}, extKey={}", layer.wireName(),
            request.getFromVirtualAccount(), request.getToVirtualAccount(), request.getAmount(), request.getExtKey());
        return gateway.call(layer, TRANSFER_V2, request.toParams());
    }

    public GatewayResponse getTransfer(Layer layer, String transferId) {
        return gateway.call(layer, GET_TRANSFER, Map.of("transfer_id", transferId), CallOptions.forceRefresh());
    }

    public GatewayResponse getVirtualAccount(Layer layer, String virtualAccount, CallOptions options) {
        return gateway.call(layer, "get_virtual_account", Map.of("virtual_account", virtualAccount), options);
    }

    public GatewayResponse listPayments(Layer layer, PlatformDTOs.PaymentFilter filter) {
        return gateway.call(layer, "list_payments_v2", filter == null ? Map.of() : filter.toParams());
    }

    public GatewayResponse getPayment(Layer layer, String paymentId) {
        return gateway.call(layer, "get_payment", Map.of("payment_id", paymentId));
    }

    /**
     * Credit an incoming payment to one or more virtual accounts.
     */
    public GatewayResponse identifyPayment(Layer layer, String paymentId, List<PlatformDTOs.PaymentOwner> owners) {
        return gateway.call(layer, "identification_payment", PlatformDTOs.ownersParams(paymentId, owners));
    }

    /**
     * Round trip through signing and transport. Used to check a freshly installed credential.
     */
    public GatewayResponse echo(Layer layer, String text) {
        return gateway.call(layer, "echo", Map.of("text", text));
    }

    /**
     * Transfer outcome of a successful transfer or transfer lookup.
     * A transfer result may carry the id at the top level or nested under {@code transfer}.
     */
    public Optional<PlatformDTOs.TransferResult> readTransfer(GatewayResponse response) {
        if (!response.isSuccess() || response.getResult() == null || response.getResult().isNull()) {
            return Optional.empty();
        }
        JsonNode node = unwrap(response.getResult(), "transfer");
        PlatformDTOs.TransferResult result = convert(node, PlatformDTOs.TransferResult.class);
        if (result.getTransferId() == null && node.hasNonNull("id")) {
            result.setTransferId(node.get("id").asText());
        }
        return Optional.of(result);
    }

    public Optional<PlatformDTOs.VirtualAccount> readVirtualAccount(GatewayResponse response) {
        if (response.getResult() == null || response.getResult().isNull()) {
            return Optional.empty();
        }
        return Optional.of(convert(unwrap(response.getResult(), "virtual_account"), PlatformDTOs.VirtualAccount.class));
    }

    public Optional<PlatformDTOs.Payment> readPayment(GatewayResponse response) {
        if (response.getResult() == null || response.getResult().isNull()) {
            return Optional.empty();
        }
        return Optional.of(convert(unwrap(response.getResult(), "payment"), PlatformDTOs.Payment.class));
    }

    private static JsonNode unwrap(JsonNode result, String field) {
        JsonNode nested = result.get(field);
        return nested != null && nested.isObject() ? nested : result;
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new PlatformResponseException("Unexpected " + type.getSimpleName() + " structure: " + e.getOriginalMessage(), e);
        }
    }
}
