package com.ke.hal.collaborator.action;

import com.ke.hal.exception.TransientCollaboratorException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpActionCallerTest {

    private MockWebServer server;
    private final HttpActionCaller caller = new HttpActionCaller(new OkHttpClient());

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsQueryHeadersAndBody() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));

        Map<String, String> query = new LinkedHashMap<>();
        query.put("units", "metric");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Api-Key", "secret");
        ActionRequest request = ActionRequest.builder()
                .method("post")
                .url(server.url("/orders/42").toString())
                .query(query)
                .headers(headers)
                .contentType("application/json")
                .body("{\"qty\":1}")
                .build();

        ActionResponse response = caller.invoke(request, Duration.ofSeconds(5));

        assertTrue(response.isSuccessful());
        assertEquals("{\"ok\":true}", response.getBody());
        RecordedRequest recorded = server.takeRequest();
        assertEquals("POST", recorded.getMethod());
        assertEquals("/orders/42?units=metric", recorded.getPath());
        assertEquals("secret", recorded.getHeader("X-Api-Key"));
        assertEquals("{\"qty\":1}", recorded.getBody().readUtf8());
    }

    @Test
    void returnsErrorStatusAsResponse() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("no such order"));

        ActionResponse response = caller.invoke(ActionRequest.builder().method("GET")
                .url(server.url("/orders/1").toString()).build(), Duration.ofSeconds(5));

        assertFalse(response.isSuccessful());
        assertEquals(404, response.getStatus());
        assertEquals("no such order", response.getBody());
    }

    @Test
    void networkFailureIsTransient() throws IOException {
        String url = server.url("/orders/1").toString();
        server.shutdown();

        assertThrows(TransientCollaboratorException.class, () -> caller.invoke(ActionRequest.builder().method("GET")
                .url(url).build(), Duration.ofSeconds(2)));
    }
}
