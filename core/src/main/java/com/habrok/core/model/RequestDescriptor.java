package com.habrok.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 전송 직전의 확정 요청(병합된 헤더 + JSON 플래그).
 * 논리 호출 1건당 한 번 만들어지고, 이후 모든 시도에서 그대로 재사용된다.
 */
public final class RequestDescriptor {
    private final String method;
    private final String uri;
    private final Map<String, String> headers;
    private final boolean jsonMode;
    private final Object body;

    public RequestDescriptor(String method, String uri, Map<String, String> headers, boolean jsonMode, Object body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = (headers == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.jsonMode = jsonMode;
        this.body = body;
    }

    public String getMethod() { return method; }
    public String getUri() { return uri; }
    public Map<String, String> getHeaders() { return headers; }
    public boolean isJsonMode() { return jsonMode; }
    public Object getBody() { return body; }

    /** 헤더 조회(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    @Override
    public String toString() {
        return "RequestDescriptor[" + method + " " + uri + ", json=" + jsonMode + "]";
    }
}
