package com.habrok.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.habrok.core.model.AttemptResult;
import com.habrok.core.model.ClientConfig;
import com.habrok.core.model.RequestDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * java.net.http.HttpClient 기반 기본 전송 어댑터.
 * 모든 실패를 {@link AttemptResult.TransportFailure}로 돌려주므로 반환 future는 예외로 끝나지 않는다.
 */
public class JdkHttpTransport implements Transport {

    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest req);
    }

    private final Duration timeout;
    private final HttpSender sender;
    private final ObjectMapper mapper;

    public JdkHttpTransport(ClientConfig config) {
        this(config, HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build());
    }

    public JdkHttpTransport(ClientConfig config, HttpClient client) {
        this(config, req -> client.sendAsync(req, HttpResponse.BodyHandlers.ofString()));
    }

    public JdkHttpTransport(ClientConfig config, HttpSender sender) {
        this.timeout = Objects.requireNonNull(config, "config").getTimeout();
        this.sender = Objects.requireNonNull(sender, "sender");
        // 첫 값 뒤에 남은 토큰이 있으면 파싱 실패로 보고 원문 유지
        this.mapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    @Override
    public CompletableFuture<AttemptResult> attempt(RequestDescriptor descriptor) {
        final HttpRequest req;
        try {
            req = toHttpRequest(descriptor);
        } catch (RuntimeException | JsonProcessingException e) {
            // 잘못된 URI/메서드/본문: 코드 없음, 재시도 안 됨
            LOG.debug("Invalid request {}: {}", descriptor, e.getMessage());
            return CompletableFuture.completedFuture(new AttemptResult.TransportFailure(e, TransportErrors.codeOf(e)));
        }

        final CompletableFuture<HttpResponse<String>> sent;
        try {
            sent = sender.sendAsync(req);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(new AttemptResult.TransportFailure(e, TransportErrors.codeOf(e)));
        }

        return sent.handle((resp, ex) -> {
            if (ex != null) {
                Throwable cause = TransportErrors.unwrap(ex);
                return new AttemptResult.TransportFailure(cause, TransportErrors.codeOf(cause));
            }
            return toReply(resp, descriptor.isJsonMode());
        });
    }

    HttpRequest toHttpRequest(RequestDescriptor d) throws JsonProcessingException {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(d.getUri()))
                .timeout(timeout);

        d.getHeaders().forEach(b::header);

        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.noBody();
        Object body = d.getBody();
        if (body != null) {
            if (d.isJsonMode() && !(body instanceof String)) {
                publisher = HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body));
                if (d.header("Content-Type") == null) b.header("Content-Type", "application/json");
            } else {
                publisher = HttpRequest.BodyPublishers.ofString(String.valueOf(body));
            }
        }
        if (d.isJsonMode() && d.header("Accept") == null) {
            b.header("Accept", "application/json");
        }
        return b.method(d.getMethod(), publisher).build();
    }

    AttemptResult.HttpReply toReply(HttpResponse<String> resp, boolean json) {
        Map<String, List<String>> headers = new LinkedHashMap<>(resp.headers().map());
        String text = (resp.body() == null) ? "" : resp.body();
        Object body = json ? parseJsonOrText(text) : text;
        return new AttemptResult.HttpReply(resp.statusCode(), headers, body);
    }

    /** JSON이 아니면 원문 문자열 유지 */
    private Object parseJsonOrText(String text) {
        if (text.isBlank()) return text;
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.debug("Response body is not JSON, keeping raw text ({} chars)", text.length());
            return text;
        }
    }
}
