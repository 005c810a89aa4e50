package com.blockflow.blockflow_engine.tool;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpToolInvoker")
class HttpToolInvokerTest {

    private MockRestServiceServer server;
    private HttpToolInvoker invoker;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        EngineProperties properties = new EngineProperties();
        properties.getToolService().setBaseUrl("http://tools.local/");
        invoker = new HttpToolInvoker(restTemplate, new ObjectMapper(), properties, new SyncTaskExecutor());
    }

    @Test
    @DisplayName("posts params as JSON and returns the success envelope")
    void success() {
        server.expect(requestTo("http://tools.local/api/tools/function_execute"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"code\":\"return 1;\"}"))
                .andRespond(withSuccess("{\"success\":true,\"output\":{\"result\":1}}", MediaType.APPLICATION_JSON));

        ToolResponse response = invoker.invoke("function_execute", Map.of("code", "return 1;")).join();

        assertThat(response.success()).isTrue();
        assertThat(response.output()).isEqualTo(Map.of("result", 1));
        server.verify();
    }

    @Test
    @DisplayName("passes through an error envelope sent with a non-2xx status")
    void errorEnvelope() {
        server.expect(requestTo("http://tools.local/api/tools/http_request"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"success\":false,\"error\":\"upstream returned 503\"}"));

        ToolResponse response = invoker.call("http_request", Map.of());

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("upstream returned 503");
    }

    @Test
    @DisplayName("turns a bare HTTP error into a failed envelope")
    void bareHttpError() {
        server.expect(requestTo("http://tools.local/api/tools/http_request"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR).body("oops"));

        ToolResponse response = invoker.call("http_request", Map.of());

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("http_request returned HTTP 500");
    }

    @Test
    @DisplayName("rejects a 2xx answer that is not an envelope")
    void notAnEnvelope() {
        server.expect(requestTo("http://tools.local/api/tools/http_request"))
                .andRespond(withSuccess("<html/>", MediaType.TEXT_HTML));

        ToolResponse response = invoker.call("http_request", Map.of());

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("http_request returned a response that is not a tool envelope");
    }
}
