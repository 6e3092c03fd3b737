package com.scicalc.mathfrontend.symbolic;

import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scicalc.mathfrontend.engine.MathOperation;

/**
 * HTTP client for the SymPy service. Requests are {@code {"expression": ..., "variable": ...}}
 * posted to {@code <baseUrl>/<operation>}; answers are {@code {"result", "latex", "execution_time_ms"}}
 * or {@code {"error"}}. Timeouts are whatever the supplied {@link RestTemplate} was built with.
 */
public class SymbolicClient {

    private static final Logger log = LoggerFactory.getLogger(SymbolicClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SymbolicClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String getBaseUrl() { return baseUrl; }

    public SymbolicResult request(MathOperation operation, String expression, String variable) {
        String url = baseUrl + operation.endpoint();

        Map<String, String> body = new HashMap<>();
        body.put("expression", expression);
        if (variable != null) {
            body.put("variable", variable);
        }
        log.debug("Sending {} to {}", body, url);

        ResponseEntity<Map> response;
        try {
            response = restTemplate.postForEntity(url, body, Map.class);
        } catch (HttpStatusCodeException e) {
            throw new SymbolicClientException(SymbolicClientException.Reason.SERVER_ERROR,
                    "Server error: " + extractError(e), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new SymbolicClientException(SymbolicClientException.Reason.TIMEOUT,
                        "Symbolic service timed out", e);
            }
            throw new SymbolicClientException(SymbolicClientException.Reason.SERVICE_UNAVAILABLE,
                    "Symbolic service not running at " + baseUrl, e);
        } catch (RestClientException e) {
            throw new SymbolicClientException(SymbolicClientException.Reason.INVALID_RESPONSE,
                    "Invalid response from symbolic service: " + e.getMessage(), e);
        }

        if (response.getStatusCode() != HttpStatus.OK || response.getBody() == null) {
            throw new SymbolicClientException(SymbolicClientException.Reason.INVALID_RESPONSE,
                    "Symbolic service returned status " + response.getStatusCode());
        }
        return parseResponse(response.getBody());
    }

    /** True when {@code GET /health} answers 200. */
    public boolean healthCheck() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/health", String.class);
            return response.getStatusCode() == HttpStatus.OK;
        } catch (RestClientException e) {
            log.debug("Symbolic service health check failed: {}", e.getMessage());
            return false;
        }
    }

    private SymbolicResult parseResponse(Map<?, ?> body) {
        Object error = body.get("error");
        if (error instanceof String message) {
            throw new SymbolicClientException(SymbolicClientException.Reason.SERVER_ERROR, "Server error: " + message);
        }

        Object result = body.get("result");
        Object latex = body.get("latex");
        Object time = body.get("execution_time_ms");
        if (result instanceof String text && latex instanceof String markup) {
            double executionTimeMs = time instanceof Number number ? number.doubleValue() : 0;
            return new SymbolicResult(text, markup, executionTimeMs);
        }
        throw new SymbolicClientException(SymbolicClientException.Reason.INVALID_RESPONSE,
                "Invalid response from symbolic service: missing 'result' or 'latex'");
    }

    private String extractError(HttpStatusCodeException e) {
        String raw = e.getResponseBodyAsString();
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (JsonProcessingException notJson) {
            log.debug("Error body from symbolic service is not JSON: {}", raw);
        }
        return "HTTP " + e.getRawStatusCode();
    }
}
