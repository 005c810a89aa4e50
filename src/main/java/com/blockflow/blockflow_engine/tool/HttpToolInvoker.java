package com.blockflow.blockflow_engine.tool;

import com.blockflow.blockflow_engine.config.EngineConfig;
import com.blockflow.blockflow_engine.config.EngineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Calls tools hosted by the tool service over HTTP.
 *
 * Request:  POST {baseUrl}/api/tools/{toolName} with the params as JSON body
 * Response: the envelope { "success": true, "output": {...} } or { "success": false, "error": "..." }
 *
 * Non-2xx answers that still carry an envelope are passed through; any other transport
 * failure is turned into a {@code success=false} envelope so the calling block fails
 * normally instead of aborting the run from the invoker.
 */
@Slf4j
@Component
public class HttpToolInvoker implements ToolInvoker {

    private final RestTemplate     restTemplate;
    private final ObjectMapper     objectMapper;
    private final EngineProperties properties;
    private final TaskExecutor     toolExecutor;

    public HttpToolInvoker(RestTemplate restTemplate,
                           ObjectMapper objectMapper,
                           EngineProperties properties,
                           @Qualifier(EngineConfig.TOOL_EXECUTOR) TaskExecutor toolExecutor) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.toolExecutor = toolExecutor;
    }

    @Override
    public CompletableFuture<ToolResponse> invoke(String toolName, Map<String, Object> params) {
        return CompletableFuture.supplyAsync(() -> call(toolName, params), toolExecutor);
    }

    ToolResponse call(String toolName, Map<String, Object> params) {
        String url = buildUrl(toolName);
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));

            HttpEntity<Map<String, Object>> request = new HttpEntity<>(params, headers);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, request, String.class);

            log.debug("Tool {} answered {}", toolName, response.getStatusCode().value());
            return parseEnvelope(toolName, response.getBody());

        } catch (HttpStatusCodeException ex) {
            ToolResponse envelope = tryParseEnvelope(ex.getResponseBodyAsString());
            if (envelope != null) {
                return envelope;
            }
            log.warn("Tool {} returned HTTP {}", toolName, ex.getStatusCode().value());
            return ToolResponse.error(toolName + " returned HTTP " + ex.getStatusCode().value());

        } catch (RestClientException ex) {
            log.error("Tool {} call to {} failed: {}", toolName, url, ex.getMessage());
            return ToolResponse.error("Failed to reach tool " + toolName + ": " + ex.getMessage());
        }
    }

    private ToolResponse parseEnvelope(String toolName, String body) {
        ToolResponse envelope = tryParseEnvelope(body);
        if (envelope == null) {
            return ToolResponse.error(toolName + " returned a response that is not a tool envelope");
        }
        return envelope;
    }

    private ToolResponse tryParseEnvelope(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject() || !node.has("success")) {
                return null;
            }
            return objectMapper.treeToValue(node, ToolResponse.class);
        } catch (JsonProcessingException e) {
            // not JSON, or JSON of another shape
            return null;
        }
    }

    private String buildUrl(String toolName) {
        String base = properties.getToolService().getBaseUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        String path = properties.getToolService().getPath().replace("{tool}", toolName);
        return base + (path.startsWith("/") ? path : "/" + path);
    }
}
