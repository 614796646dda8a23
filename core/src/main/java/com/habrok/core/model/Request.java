package com.habrok.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 호출자 입력: method/uri 필수, 헤더/본문은 선택 */
public final class Request {
    private final String method;
    private final String uri;
    private final Map<String, String> headers;
    private final Object body; // null이면 본문 없음

    private Request(Builder b) {
        this.method = b.method;
        this.uri = b.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
    }

    public String getMethod() { return method; }
    public String getUri() { return uri; }
    public Map<String, String> getHeaders() { return headers; }
    public Object getBody() { return body; }

    /** 가장 흔한 GET 요청 단축 */
    public static Request get(String uri) {
        return builder().method("GET").uri(uri).build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String method;
        private String uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        public Builder method(String method) { this.method = method; return this; }
        public Builder uri(String uri) { this.uri = uri; return this; }
        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }
        public Builder headers(Map<String, String> headers) {
            if (headers != null) headers.forEach(this::header);
            return this;
        }
        public Builder body(Object body) { this.body = body; return this; }

        public Request build() {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(uri, "uri");
            return new Request(this);
        }
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
