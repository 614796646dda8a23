package com.habrok.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 번의 전송 시도 결과.
 * <ul>
 *   <li>{@link TransportFailure}: 네트워크/프로토콜 수준 실패. 원본 예외를 그대로 보관한다.</li>
 *   <li>{@link HttpReply}: HTTP 응답(상태코드 무관).</li>
 * </ul>
 * 분류기가 즉시 소비하며, 시도 간에 보관하지 않는다.
 */
public sealed interface AttemptResult permits AttemptResult.TransportFailure, AttemptResult.HttpReply {

    /** code는 ECONNRESET 같은 기계 판독용 코드. 알 수 없으면 null. */
    record TransportFailure(Throwable error, String code) implements AttemptResult {
        public TransportFailure {
            Objects.requireNonNull(error, "error");
        }

        public String message() { return error.getMessage(); }
    }

    record HttpReply(int statusCode, Map<String, List<String>> headers, Object body) implements AttemptResult {
        public HttpReply {
            headers = (headers == null) ? Map.of() : Collections.unmodifiableMap(headers);
        }

        public ResponseData toResponseData() {
            return new ResponseData(statusCode, headers, body);
        }
    }
}
