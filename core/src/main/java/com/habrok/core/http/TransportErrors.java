package com.habrok.core.http;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * JDK 예외 → 기계 판독용 전송 오류 코드(ECONNRESET 등).
 * 판단 불가면 null (= 재시도 대상 아님).
 */
public final class TransportErrors {
    private TransportErrors() {}

    public static final String ECONNRESET = "ECONNRESET";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String ETIMEDOUT = "ETIMEDOUT";             // 연결 타임아웃
    public static final String ESOCKETTIMEDOUT = "ESOCKETTIMEDOUT"; // 연결 후 응답 대기 타임아웃
    public static final String ENOTFOUND = "ENOTFOUND";
    public static final String EPIPE = "EPIPE";

    /** CompletableFuture 래퍼를 벗겨 원본 예외를 꺼낸다. */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static String codeOf(Throwable t) {
        Throwable cur = unwrap(t);
        // 원인 체인을 따라가며 첫 매칭 코드 반환
        for (int depth = 0; cur != null && depth < 8; depth++) {
            String code = directCode(cur);
            if (code != null) return code;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return null;
    }

    private static String directCode(Throwable t) {
        if (t instanceof HttpConnectTimeoutException) return ETIMEDOUT;
        if (t instanceof HttpTimeoutException) return ESOCKETTIMEDOUT;
        if (t instanceof SocketTimeoutException) {
            String m = t.getMessage();
            return (m != null && m.toLowerCase(Locale.ROOT).contains("connect")) ? ETIMEDOUT : ESOCKETTIMEDOUT;
        }
        if (t instanceof ConnectException) return ECONNREFUSED;
        if (t instanceof UnknownHostException) return ENOTFOUND;
        if (!(t instanceof java.io.IOException)) return null;

        String msg = t.getMessage();
        if (msg == null) return null;
        String lower = msg.toLowerCase(Locale.ROOT);
        if (lower.contains("connection reset")) return ECONNRESET;
        if (lower.contains("broken pipe")) return EPIPE;
        // 서버가 응답 없이 연결을 닫은 경우(HttpClient 메시지)
        if (lower.contains("received no bytes") || lower.contains("eof reached")
                || lower.contains("connection closed")) {
            return ECONNRESET;
        }
        if (lower.contains("timed out")) return ETIMEDOUT;
        return null;
    }
}
