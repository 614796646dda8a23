package com.habrok.core.http;

import com.habrok.core.model.ClientConfig;
import com.habrok.core.model.Request;
import com.habrok.core.model.RequestDescriptor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 호출자 Request → 확정 RequestDescriptor.
 * 기본 헤더 위에 호출자 헤더를 덮어쓴다(호출자 우선). disableCustomHeaders면 호출자 헤더만.
 */
public final class RequestEnvelopeFactory {

    public static final String USER_AGENT = "User-Agent";
    public static final String X_JAVA_PLATFORM = "X-Java-Platform";
    public static final String X_JAVA_VERSION = "X-Java-Version";

    private final boolean customHeaders;
    private final boolean json;
    private final Map<String, String> defaultHeaders;

    public RequestEnvelopeFactory(ClientConfig config, String version) {
        Objects.requireNonNull(config, "config");
        this.customHeaders = !config.isDisableCustomHeaders();
        this.json = !config.isDisableAutomaticJson();
        this.defaultHeaders = customHeaders ? defaultHeaders(version) : Map.of();
    }

    public RequestDescriptor resolve(Request request) {
        Objects.requireNonNull(request, "request");
        Map<String, String> merged = new LinkedHashMap<>(defaultHeaders);
        request.getHeaders().forEach((k, v) -> {
            // 대소문자만 다른 기본 헤더는 호출자 값으로 교체
            merged.keySet().removeIf(existing -> existing.equalsIgnoreCase(k));
            merged.put(k, v);
        });
        return new RequestDescriptor(
                request.getMethod().toUpperCase(Locale.ROOT),
                request.getUri(),
                merged,
                json,
                request.getBody());
    }

    public Map<String, String> getDefaultHeaders() { return defaultHeaders; }

    static Map<String, String> defaultHeaders(String version) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(USER_AGENT, "habrok/" + version);
        h.put(X_JAVA_PLATFORM, System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT)
                + "/" + System.getProperty("os.arch", "unknown"));
        h.put(X_JAVA_VERSION, Runtime.version().toString());
        return Map.copyOf(h);
    }
}
