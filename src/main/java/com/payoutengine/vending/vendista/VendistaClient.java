package com.payoutengine.vending.vendista;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payoutengine.vending.TerminalDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * HTTP client for the Vendista terminal API.
 *
 * Handles:
 * - Bearer authentication
 * - Both response shapes of /transactions ({items: [...]} or a bare array)
 * - Error translation to {@link TerminalDataException}
 */
@Component
@Slf4j
public class VendistaClient {

    private final RestTemplate restTemplate;
    private final VendistaProperties properties;
    private final ObjectMapper objectMapper;

    @Autowired
    public VendistaClient(VendistaProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, createRestTemplate(properties));
    }

    VendistaClient(VendistaProperties properties, ObjectMapper objectMapper, RestTemplate restTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplate;

        log.info("Vendista client initialized: baseUrl={}, configured={}", properties.getBaseUrl(), properties.isConfigured());
    }

    /**
     * Sales of one machine between two dates, inclusive.
     */
    public List<VendistaDTOs.Transaction> fetchTransactions(String machineId, LocalDate from, LocalDate to) {
        if (!properties.isConfigured()) {
            throw new TerminalDataException("Vendista API key is not configured (payout-engine.vendista.api-key)");
        }

        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
            .path("/transactions")
            .queryParam("machine_id", machineId)
            .queryParam("date_from", from)
            .queryParam("date_to", to)
            .toUriString();

        log.debug("Fetching transactions: machineId={}, from={}, to={}", machineId, from, to);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                url,
                HttpMethod.GET,
                new HttpEntity<>(createHeaders()),
                String.class
            );
            body = response.getBody();

        } catch (RestClientResponseException e) {
            log.error("Vendista rejected transactions request: machineId={}, status={}", machineId, e.getStatusCode().value());
            throw new TerminalDataException("Vendista API error: " + e.getStatusCode().value() + " - "
                + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            log.error("Error fetching transactions from Vendista: machineId={}", machineId, e);
            throw new TerminalDataException("Vendista API unreachable: " + e.getMessage(), e);
        }

        return parseTransactions(body);
    }

    private List<VendistaDTOs.Transaction> parseTransactions(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.isArray()) {
                return Arrays.asList(objectMapper.treeToValue(node, VendistaDTOs.Transaction[].class));
            }
            if (node.isObject()) {
                List<VendistaDTOs.Transaction> items = objectMapper.treeToValue(node, VendistaDTOs.TransactionPage.class).getItems();
                if (items == null) {
                    throw new TerminalDataException("Invalid transactions response format: items is null");
                }
                return items;
            }
        } catch (JsonProcessingException e) {
            throw new TerminalDataException("Invalid transactions response format: " + e.getOriginalMessage(), e);
        }
        throw new TerminalDataException("Invalid transactions response format");
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(properties.getApiKey());
        return headers;
    }

    private static RestTemplate createRestTemplate(VendistaProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getTimeout().toMillis());
        factory.setReadTimeout((int) properties.getTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
