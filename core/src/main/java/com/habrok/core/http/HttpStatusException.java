package com.habrok.core.http;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * HTTP 응답(≥ 400)에서 비롯된 종결 오류.
 * 메시지는 사유 문구(예: "Too Many Requests"), data는 원본 응답 본문.
 * 전송 계층 오류는 이 타입으로 감싸지 않고 원본 그대로 전달된다.
 */
public class HttpStatusException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String reasonPhrase;
    private final transient Object data;
    private final transient Map<String, List<String>> headers;

    public HttpStatusException(int statusCode, String reasonPhrase, Object data, Map<String, List<String>> headers) {
        super(reasonPhrase);
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.data = data;
        this.headers = (headers == null) ? Map.of() : headers;
    }

    /** 구조화된 HTTP 오류 표식. 전송 오류와 구분할 때 사용. */
    public boolean isHttpError() { return true; }

    public int getStatusCode() { return statusCode; }
    public String getReasonPhrase() { return reasonPhrase; }
    public Object getData() { return data; }
    public Map<String, List<String>> getHeaders() { return headers; }

    @Override
    public String toString() {
        return "HttpStatusException: " + statusCode + " " + reasonPhrase;
    }
}
