package com.example.cronhooks.service;

import com.example.cronhooks.domain.FailureKind;
import com.example.cronhooks.domain.TargetMethod;
import com.example.cronhooks.domain.WebhookJob;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebhookCallerTest {

    private HttpServer server;
    private ExecutorService serverPool;
    private WebhookCaller caller;

    private final AtomicReference<String> seenMethod = new AtomicReference<>();
    private final AtomicReference<Headers> seenHeaders = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverPool = Executors.newCachedThreadPool();
        server.setExecutor(serverPool);

        server.createContext("/ok", ex -> {
            capture(ex);
            respond(ex, 200, "{\"ok\":true}");
        });
        server.createContext("/boom", ex -> {
            capture(ex);
            respond(ex, 500, "internal");
        });
        server.createContext("/moved", ex -> {
            capture(ex);
            ex.getResponseHeaders().set("Location", "/ok");
            respond(ex, 302, "");
        });
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "late");
        });
        server.start();

        caller = new WebhookCaller(WebClient.builder(), 262_144);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverPool.shutdownNow();
    }

    private void capture(HttpExchange ex) throws IOException {
        seenMethod.set(ex.getRequestMethod());
        seenHeaders.set(ex.getRequestHeaders());
        byte[] in = ex.getRequestBody().readAllBytes();
        seenBody.set(new String(in, StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] out = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(code, out.length == 0 ? -1 : out.length);
        if (out.length > 0) {
            try (OutputStream os = ex.getResponseBody()) {
                os.write(out);
            }
        }
        ex.close();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static WebhookJob job(TargetMethod method, String url, String body) {
        WebhookJob j = new WebhookJob();
        j.setId(1L);
        j.setHttpMethod(method);
        j.setUrl(url);
        j.setBody(body);
        j.setTimeoutSeconds(5);
        return j;
    }

    @Test
    void call_PostWithBody_SuccessAndDefaultHeaders() {
        CallOutcome out = caller.call(job(TargetMethod.POST, url("/ok"), "{\"a\":1}"));

        assertTrue(out.isSuccess());
        assertEquals(200, out.getResponseCode());
        assertEquals("{\"ok\":true}", out.getResponseBody());
        assertNull(out.getFailureKind());
        assertEquals("POST", seenMethod.get());
        assertEquals("{\"a\":1}", seenBody.get());
        assertEquals("application/json", seenHeaders.get().getFirst("Content-Type"));
        assertEquals(WebhookCaller.DEFAULT_USER_AGENT, seenHeaders.get().getFirst("User-Agent"));
    }

    @Test
    void call_CustomHeaders_OverrideDefaults() {
        WebhookJob j = job(TargetMethod.PUT, url("/ok"), "x=1");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "text/plain");
        headers.put("X-Api-Key", "secret");
        j.setHeaders(headers);

        CallOutcome out = caller.call(j);

        assertTrue(out.isSuccess());
        assertEquals("PUT", seenMethod.get());
        assertEquals("text/plain", seenHeaders.get().getFirst("Content-Type"));
        assertEquals("secret", seenHeaders.get().getFirst("X-Api-Key"));
    }

    @Test
    void call_GetWithoutBody_SendsNoBody() {
        CallOutcome out = caller.call(job(TargetMethod.GET, url("/ok"), null));

        assertTrue(out.isSuccess());
        assertEquals("GET", seenMethod.get());
        assertEquals("", seenBody.get());
    }

    @Test
    void call_ServerError_NonSuccessResponse() {
        CallOutcome out = caller.call(job(TargetMethod.POST, url("/boom"), null));

        assertFalse(out.isSuccess());
        assertEquals(500, out.getResponseCode());
        assertEquals("internal", out.getResponseBody());
        assertEquals(FailureKind.NON_SUCCESS_RESPONSE, out.getFailureKind());
        assertNull(out.getErrorMessage());
    }

    @Test
    void call_Redirect_CountsAsDeliveredAndIsNotFollowed() {
        CallOutcome out = caller.call(job(TargetMethod.POST, url("/moved"), null));

        assertTrue(out.isSuccess());
        assertEquals(302, out.getResponseCode());
    }

    @Test
    void call_SlowServer_Timeout() {
        WebhookJob j = job(TargetMethod.GET, url("/slow"), null);
        j.setTimeoutSeconds(1);

        CallOutcome out = caller.call(j);

        assertFalse(out.isSuccess());
        assertNull(out.getResponseCode());
        assertEquals(FailureKind.TRANSPORT_TIMEOUT, out.getFailureKind());
        assertEquals("Request timed out after 1 seconds", out.getErrorMessage());
    }

    @Test
    void call_NothingListening_TransportError() throws IOException {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }

        CallOutcome out = caller.call(job(TargetMethod.POST, "http://127.0.0.1:" + port + "/x", null));

        assertFalse(out.isSuccess());
        assertNull(out.getResponseCode());
        assertEquals(FailureKind.TRANSPORT_ERROR, out.getFailureKind());
        assertNotNull(out.getErrorMessage());
    }

    @Test
    void mergeHeaders_NullCustom_DefaultsOnly() {
        HttpHeaders h = WebhookCaller.mergeHeaders(null);

        assertEquals("application/json", h.getFirst(HttpHeaders.CONTENT_TYPE));
        assertEquals(WebhookCaller.DEFAULT_USER_AGENT, h.getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void mergeHeaders_CustomUserAgent_Kept() {
        HttpHeaders h = WebhookCaller.mergeHeaders(Collections.singletonMap("user-agent", "mine/2"));

        assertEquals("mine/2", h.getFirst(HttpHeaders.USER_AGENT));
        assertEquals(1, h.get(HttpHeaders.USER_AGENT).size());
    }
}
