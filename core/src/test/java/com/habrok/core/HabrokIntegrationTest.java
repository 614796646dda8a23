package com.habrok.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.habrok.core.http.HttpStatusException;
import com.habrok.core.model.ClientConfig;
import com.habrok.core.model.Request;
import com.habrok.core.model.ResponseData;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/** 실제 HttpClient + 로컬 HttpServer로 끝까지 확인 */
class HabrokIntegrationTest {

    static HttpServer s;
    static String base;
    static final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();

        s.createContext("/ok", ex -> {
            count(ex);
            respond(ex, 200, "{\"ua\":\"" + ex.getRequestHeaders().getFirst("User-Agent") + "\"}");
        });
        s.createContext("/limited", ex -> {
            count(ex);
            respond(ex, 429, "{\"x\":\"busy\"}");
        });
        s.createContext("/flaky", ex -> {
            int n = count(ex);
            if (n == 1) respond(ex, 429, "{}");
            else respond(ex, 200, "{\"attempt\":" + n + "}");
        });
        s.createContext("/boom", ex -> {
            count(ex);
            respond(ex, 500, "{\"x\":\"down\"}");
        });
        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
    }

    @BeforeEach
    void reset() {
        hits.clear();
    }

    private static int count(HttpExchange ex) {
        return hits.computeIfAbsent(ex.getRequestURI().getPath(), k -> new AtomicInteger()).incrementAndGet();
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static int hitsOf(String path) {
        AtomicInteger n = hits.get(path);
        return (n == null) ? 0 : n.get();
    }

    private final Habrok habrok = new Habrok(new ClientConfig().setRetryMinDelayMs(0).setTimeoutMs(5000));

    @Test
    void ok_resolves_with_parsed_json_and_default_user_agent() throws Exception {
        ResponseData out = habrok.send(Request.get(base + "/ok"));

        assertThat(out.getStatusCode()).isEqualTo(200);
        assertThat(out.header("content-type")).isEqualTo("application/json");
        assertThat(((JsonNode) out.getBody()).get("ua").asText()).startsWith("habrok/");
        assertThat(hitsOf("/ok")).isEqualTo(1);
    }

    @Test
    void rate_limited_is_retried_until_ceiling() {
        Throwable err = catchThrowable(() -> habrok.send(Request.get(base + "/limited")));

        assertThat(err).isInstanceOf(HttpStatusException.class);
        assertThat(((HttpStatusException) err).getStatusCode()).isEqualTo(429);
        assertThat(((JsonNode) ((HttpStatusException) err).getData()).get("x").asText()).isEqualTo("busy");
        assertThat(hitsOf("/limited")).isEqualTo(Habrok.RETRIES);
    }

    @Test
    void flaky_recovers_on_second_attempt() throws Exception {
        ResponseData out = habrok.send(Request.get(base + "/flaky"));

        assertThat(out.getStatusCode()).isEqualTo(200);
        assertThat(((JsonNode) out.getBody()).get("attempt").asInt()).isEqualTo(2);
    }

    @Test
    void server_error_is_not_retried() {
        Throwable err = catchThrowable(() -> habrok.send(Request.get(base + "/boom")));

        assertThat(err).isInstanceOf(HttpStatusException.class).hasMessage("Internal Server Error");
        assertThat(hitsOf("/boom")).isEqualTo(1);
    }
}
