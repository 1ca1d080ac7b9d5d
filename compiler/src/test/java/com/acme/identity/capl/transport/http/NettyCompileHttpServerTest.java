package com.acme.identity.capl.transport.http;

import com.acme.identity.capl.compiler.CaplCompiler;
import com.acme.identity.capl.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NettyCompileHttpServerTest {
    private static final String SOURCE = """
        IF user is Guest
            STATE enabled
            REQUIRE MFA
        END
        """;

    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(Duration.ofSeconds(5)).build();
    private NettyCompileHttpServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new NettyCompileHttpServer(0, 64 * 1024, new CaplCompiler(256), "Generated");
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void shouldCompilePlainTextSource() throws Exception {
        HttpResponse<String> response = post("/v1/compile", "text/plain", SOURCE);

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("content-type").orElse("").startsWith("application/json"));
        JsonNode body = JsonCodec.readTree(response.body());
        assertEquals("Generated-1-Guest", body.at("/policies/0/DisplayName").asText());
        assertTrue(body.get("diagnostics").isEmpty());
    }

    @Test
    void shouldUseNamePrefixFromJsonRequest() throws Exception {
        String request = JsonCodec.writeString(Map.of("source", SOURCE, "namePrefix", "Contoso"));
        HttpResponse<String> response = post("/v1/compile?dryRun=1", "application/json", request);

        assertEquals(200, response.statusCode());
        assertEquals("Contoso-1-Guest", JsonCodec.readTree(response.body()).at("/policies/0/DisplayName").asText());
    }

    @Test
    void shouldAnswerUnprocessableWithDiagnostics() throws Exception {
        HttpResponse<String> response = post("/v1/compile", "text/plain", "IF user is Guest\n    BLOCK\nEND\n");

        assertEquals(422, response.statusCode());
        JsonNode body = JsonCodec.readTree(response.body());
        assertTrue(body.get("policies").isEmpty());
        assertEquals("ACTION_BEFORE_STATE", body.at("/diagnostics/0/code").asText());
        assertEquals(2, body.at("/diagnostics/0/line").asInt());
    }

    @Test
    void shouldRejectBadRequests() throws Exception {
        assertEquals(400, post("/v1/compile", "application/json", "{not json").statusCode());
        assertEquals(400, post("/v1/compile", "application/json", "{\"namePrefix\":\"x\"}").statusCode());
        assertEquals(415, post("/v1/compile", "application/xml", "<x/>").statusCode());
        assertEquals(404, post("/v1/other", "text/plain", SOURCE).statusCode());
        assertEquals(405, get("/v1/compile").statusCode());
        assertEquals(405, post("/healthz", "text/plain", "").statusCode());
    }

    @Test
    void shouldAnswerHealthCheck() throws Exception {
        HttpResponse<String> response = get("/healthz");
        assertEquals(200, response.statusCode());
        assertEquals("ok", response.body());
    }

    private HttpResponse<String> post(String path, String contentType, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
            .timeout(Duration.ofSeconds(5))
            .header("Content-Type", contentType)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).timeout(Duration.ofSeconds(5)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.listenPort() + path);
    }
}
