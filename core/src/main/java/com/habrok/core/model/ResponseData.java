package com.habrok.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 성공 결과: 상태코드 + 응답 헤더 + 본문(JSON 모드면 JsonNode, 아니면 String) */
public final class ResponseData {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final Object body;

    public ResponseData(int statusCode, Map<String, List<String>> headers, Object body) {
        this.statusCode = statusCode;
        this.headers = (headers == null) ? Map.of() : Collections.unmodifiableMap(headers);
        this.body = body;
    }

    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public Object getBody() { return body; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseData other)) return false;
        return statusCode == other.statusCode
                && headers.equals(other.headers)
                && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, headers, body);
    }

    @Override
    public String toString() {
        return "ResponseData[status=" + statusCode + ", headers=" + headers.size() + "]";
    }
}
